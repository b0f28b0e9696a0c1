package pddl.util;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class SimpleDocumentPositionResolverTest {

	@Test
	public void singleLine() {
		String documentText = "text";
		SimpleDocumentPositionResolver resolver = new SimpleDocumentPositionResolver(documentText);
		assertThat(resolver.resolveToPosition(0), is(new PddlPosition(0, 0)));
		assertThat(resolver.resolveToPosition(1), is(new PddlPosition(0, 1)));
		assertThat(resolver.resolveToPosition(3), is(new PddlPosition(0, 3)));
		assertThat(resolver.resolveToPosition(documentText.length()), is(new PddlPosition(0, 4)));
		assertThat(resolver.getLineCount(), is(1));
	}

	@Test
	public void linuxLineSeparator() {
		String line1 = "line1";
		SimpleDocumentPositionResolver resolver = new SimpleDocumentPositionResolver(line1 + "\nline2");
		assertThat(resolver.resolveToPosition(0), is(new PddlPosition(0, 0)));
		assertThat(resolver.resolveToPosition(line1.length()), is(new PddlPosition(0, 5)));
		assertThat(resolver.resolveToPosition(line1.length() + 1), is(new PddlPosition(1, 0)));
	}

	@Test
	public void windowsLineSeparator() {
		String line1 = "line1";
		SimpleDocumentPositionResolver resolver = new SimpleDocumentPositionResolver(line1 + "\r\nline2");
		assertThat(resolver.resolveToPosition(0), is(new PddlPosition(0, 0)));
		assertThat(resolver.resolveToPosition(line1.length() + 2), is(new PddlPosition(1, 0)));
	}

	@Test
	public void emptyLines() {
		SimpleDocumentPositionResolver resolver = new SimpleDocumentPositionResolver("a\n\n\nb");
		assertThat(resolver.getLineCount(), is(4));
		assertThat(resolver.resolveToPosition(2), is(new PddlPosition(1, 0)));
		assertThat(resolver.resolveToPosition(3), is(new PddlPosition(2, 0)));
		assertThat(resolver.resolveToPosition(5), is(new PddlPosition(3, 1)));
	}

	@Test
	public void range() {
		SimpleDocumentPositionResolver resolver = new SimpleDocumentPositionResolver("(p)\n(q)");
		assertThat(resolver.resolveToRange(4, 7), is(new PddlRange(1, 0, 1, 3)));
		assertTrue(resolver.rangeIncludesOffset(new PddlRange(1, 0, 1, 3), 5));
		assertFalse(resolver.rangeIncludesOffset(new PddlRange(1, 0, 1, 3), 1));
	}

	@Test(expected = OffsetOutOfRangeException.class)
	public void offsetPastTheEnd() {
		new SimpleDocumentPositionResolver("text").resolveToPosition(5);
	}

	@Test
	public void negativeOffset() {
		try {
			new SimpleDocumentPositionResolver("text").resolveToPosition(-1);
			fail("expected OffsetOutOfRangeException");
		} catch (OffsetOutOfRangeException e) {
			assertThat(e.getOffset(), is(-1));
		}
	}
}
