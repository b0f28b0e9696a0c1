package pddl.errors;

import java.util.Objects;

/**
 * A recoverable problem found while parsing, e.g. an unmatched bracket.
 * Line and column are zero-based.
 */
public class ParsingProblem {
	private final String problem;
	private final int lineIndex;
	private final int columnIndex;

	public ParsingProblem(String problem, int lineIndex, int columnIndex) {
		this.problem = problem;
		this.lineIndex = lineIndex;
		this.columnIndex = columnIndex;
	}

	public ParsingProblem(String problem, int lineIndex) {
		this(problem, lineIndex, 0);
	}

	public String getProblem() {
		return problem;
	}

	public int getLineIndex() {
		return lineIndex;
	}

	public int getColumnIndex() {
		return columnIndex;
	}

	@Override
	public int hashCode() {
		return Objects.hash(problem, lineIndex, columnIndex);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ParsingProblem other = (ParsingProblem) obj;
		return lineIndex == other.lineIndex && columnIndex == other.columnIndex && Objects.equals(problem, other.problem);
	}

	@Override
	public String toString() {
		return problem + " at " + (lineIndex + 1) + ":" + (columnIndex + 1);
	}
}
