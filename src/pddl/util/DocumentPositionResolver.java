package pddl.util;

/**
 * Translates document text offsets to line/character positions and ranges.
 */
public abstract class DocumentPositionResolver {

	/**
	 * @param offset character offset into the document text
	 * @return the zero-based line and character of the offset
	 * @throws OffsetOutOfRangeException if the offset is not within the document
	 */
	public abstract PddlPosition resolveToPosition(int offset);

	public PddlRange resolveToRange(int start, int end) {
		return PddlRange.from(resolveToPosition(start), resolveToPosition(end));
	}

	public PddlRange resolveToRange(TextRange textRange) {
		return resolveToRange(textRange.getStart(), textRange.getEnd());
	}

	public boolean rangeIncludesOffset(PddlRange range, int offset) {
		return range.includes(resolveToPosition(offset));
	}
}
