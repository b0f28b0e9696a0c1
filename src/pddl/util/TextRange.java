package pddl.util;

/**
 * 
 * A common abstract base for anything that covers a span of the document
 * text, i.e. tokens and syntax tree nodes.
 * 
 * Offsets are character indices into the document text. The end offset is
 * the index just after the last character.
 *
 */
public abstract class TextRange {

	public abstract int getStart();

	public abstract int getEnd();

	/**
	 * @param offset character offset in the document text
	 * @return true if offset lies between the start and the end, both inclusive
	 */
	public boolean includesIndex(int offset) {
		return offset >= getStart() && offset <= getEnd();
	}

}
