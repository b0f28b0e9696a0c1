package pddl.model;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import pddl.util.PddlRange;
import pddl.util.SimpleDocumentPositionResolver;

public class FileInfoTest {

	private static FileInfo unknown(String text) {
		FileInfo fileInfo = new UnknownFileInfo("file:///x.pddl", 1, new SimpleDocumentPositionResolver(text));
		fileInfo.setText(text);
		return fileInfo;
	}

	@Test
	public void stripComments() {
		assertThat(FileInfo.stripComments("(p) ; comment\r\n; whole line\n(q)"), is("(p) \n\n(q)"));
	}

	@Test
	public void typeReferences() {
		FileInfo fileInfo = unknown("(?t - truck ; - truck\n  ?u -  Truck ?x - trucks)");

		assertThat(fileInfo.getTypeReferences("truck"), is(Arrays.asList(
				new PddlRange(0, 6, 0, 11),
				new PddlRange(1, 8, 1, 13))));
	}

	@Test
	public void update() {
		FileInfo fileInfo = unknown("(p)");
		assertThat(fileInfo.getStatus(), is(FileStatus.PARSED));

		assertTrue(fileInfo.update(2, "(q)", false));
		assertThat(fileInfo.getStatus(), is(FileStatus.DIRTY));
		assertThat(fileInfo.getText(), is("(q)"));
		assertThat(fileInfo.getVersion(), is(2));

		assertFalse(fileInfo.update(1, "(r)", false));
		assertThat(fileInfo.getText(), is("(q)"));
	}

	@Test
	public void noVariableReferences() {
		assertThat(unknown("(p)").getVariableReferences(new Variable("p")).size(), is(0));
	}
}
