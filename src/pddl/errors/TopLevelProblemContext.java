package pddl.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import pddl.Unreachable;
import pddl.formatters.IndentingWriter;

/**
 * Collects parsing problems, keeping at most maxNumberOfProblems of them.
 * Problems past the cap are only counted.
 */
public class TopLevelProblemContext extends ProblemContext {

	private final List<ParsingProblem> problems;
	private final int maxNumberOfProblems;
	private int dropped;

	public TopLevelProblemContext(int maxNumberOfProblems) {
		this.problems = new ArrayList<>();
		this.maxNumberOfProblems = maxNumberOfProblems;
	}

	public TopLevelProblemContext() {
		this(Integer.MAX_VALUE);
	}

	@Override
	public void error(ParsingProblem problem) {
		if (problems.size() < maxNumberOfProblems) {
			problems.add(problem);
		} else {
			dropped++;
		}
	}

	@Override
	public boolean hasErrors() {
		return !problems.isEmpty() || dropped > 0;
	}

	public List<ParsingProblem> getProblems() {
		return Collections.unmodifiableList(problems);
	}

	public int getDroppedCount() {
		return dropped;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(problems.size() + dropped));
		out.write(" problem(s):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (ParsingProblem problem : problems) {
				out.newLine();
				out.write(problem.toString());
			}
			if (dropped > 0) {
				out.newLine();
				out.write("... and " + dropped + " more");
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}
}
