package pddl.util;

/**
 * Thrown when a text offset that does not belong to the document is resolved.
 * This is always a caller bug: offsets must come from the same document text.
 */
public class OffsetOutOfRangeException extends IndexOutOfBoundsException {

	private static final long serialVersionUID = 4022133515840245077L;

	private final int offset;

	public OffsetOutOfRangeException(int offset, int documentLength) {
		super("Offset " + offset + " is outside the document of length " + documentLength + ".");
		this.offset = offset;
	}

	public int getOffset() {
		return offset;
	}
}
