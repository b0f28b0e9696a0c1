package pddl.util;

/**
 * Zero-based line and character position in a document.
 */
public class PddlPosition implements Comparable<PddlPosition> {
	private final int line;
	private final int character;

	public PddlPosition(int line, int character) {
		this.line = line;
		this.character = character;
	}

	public int getLine() {
		return line;
	}

	public int getCharacter() {
		return character;
	}

	public boolean atOrBefore(PddlPosition other) {
		return compareTo(other) <= 0;
	}

	@Override
	public int compareTo(PddlPosition o) {
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		return Integer.compare(character, o.character);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + line;
		result = prime * result + character;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		PddlPosition other = (PddlPosition) obj;
		return line == other.line && character == other.character;
	}

	@Override
	public String toString() {
		return (line + 1) + ":" + (character + 1);
	}
}
