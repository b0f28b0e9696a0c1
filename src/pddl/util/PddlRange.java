package pddl.util;

/**
 * A span between two positions of one document. Both ends are inclusive when
 * testing whether a position lies in the range.
 */
public class PddlRange implements Comparable<PddlRange> {
	private final int startLine;
	private final int startCharacter;
	private final int endLine;
	private final int endCharacter;

	public PddlRange(int startLine, int startCharacter, int endLine, int endCharacter) {
		this.startLine = startLine;
		this.startCharacter = startCharacter;
		this.endLine = endLine;
		this.endCharacter = endCharacter;
	}

	public static PddlRange from(PddlPosition start, PddlPosition end) {
		return new PddlRange(start.getLine(), start.getCharacter(), end.getLine(), end.getCharacter());
	}

	public PddlPosition getStart() {
		return new PddlPosition(startLine, startCharacter);
	}

	public PddlPosition getEnd() {
		return new PddlPosition(endLine, endCharacter);
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartCharacter() {
		return startCharacter;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndCharacter() {
		return endCharacter;
	}

	public boolean includes(PddlPosition position) {
		return getStart().atOrBefore(position) && position.atOrBefore(getEnd());
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endCharacter;
		result = prime * result + endLine;
		result = prime * result + startCharacter;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		PddlRange other = (PddlRange) obj;
		return endCharacter == other.endCharacter && endLine == other.endLine &&
				startCharacter == other.startCharacter && startLine == other.startLine;
	}

	@Override
	public String toString() {
		return "PddlRange [" + getStart() + "-" + getEnd() + "]";
	}

	@Override
	public int compareTo(PddlRange o) {
		int comparedStart = getStart().compareTo(o.getStart());
		if (comparedStart != 0) {
			return comparedStart;
		}
		return getEnd().compareTo(o.getEnd());
	}

}
