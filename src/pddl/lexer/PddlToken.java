package pddl.lexer;

import pddl.util.TextRange;

public class PddlToken extends TextRange {

	private final PddlTokenType type;
	private final String text;
	private final int start;

	public PddlToken(PddlTokenType type, String text, int start) {
		this.type = type;
		this.text = text;
		this.start = start;
	}

	public static PddlToken document() {
		return new PddlToken(PddlTokenType.DOCUMENT, "", 0);
	}

	public PddlTokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	@Override
	public int getStart() {
		return start;
	}

	@Override
	public int getEnd() {
		return start + text.length();
	}

	public boolean isOpenBracket() {
		return type == PddlTokenType.OPEN_BRACKET || type == PddlTokenType.OPEN_BRACKET_OPERATOR;
	}

	@Override
	public String toString() {
		return "PddlToken [type=" + type + ", text='" + text + "', range=" + start + "~" + getEnd() + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + start;
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((text == null) ? 0 : text.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PddlToken other = (PddlToken) obj;
		if (start != other.start)
			return false;
		if (type != other.type)
			return false;
		if (text == null) {
			if (other.text != null)
				return false;
		} else if (!text.equals(other.text))
			return false;
		return true;
	}

}
