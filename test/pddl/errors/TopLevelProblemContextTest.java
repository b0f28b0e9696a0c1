package pddl.errors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class TopLevelProblemContextTest {

	@Test
	public void noProblems() {
		TopLevelProblemContext ctx = new TopLevelProblemContext();
		assertFalse(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 0 problem(s):"));
	}

	@Test
	public void format() {
		TopLevelProblemContext ctx = new TopLevelProblemContext();
		ctx.errors(Arrays.asList(
				new ParsingProblem("Unmatched open bracket", 0, 0),
				new ParsingProblem("Unmatched close bracket", 2, 4)));

		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 2 problem(s):\n" +
				"  Unmatched open bracket at 1:1\n" +
				"  Unmatched close bracket at 3:5"));
	}

	@Test
	public void cap() {
		TopLevelProblemContext ctx = new TopLevelProblemContext(1);
		ctx.error(new ParsingProblem("first", 0));
		ctx.error(new ParsingProblem("second", 1));
		ctx.error(new ParsingProblem("third", 2));

		assertThat(ctx.getProblems(), is(Arrays.asList(new ParsingProblem("first", 0, 0))));
		assertThat(ctx.getDroppedCount(), is(2));
		assertThat(ctx.format(), is("Detected 3 problem(s):\n" +
				"  first at 1:1\n" +
				"  ... and 2 more"));
	}

	@Test
	public void zeroCapStillReportsErrors() {
		TopLevelProblemContext ctx = new TopLevelProblemContext(0);
		ctx.error(new ParsingProblem("dropped", 0));

		assertTrue(ctx.hasErrors());
		assertThat(ctx.getProblems().size(), is(0));
	}
}
