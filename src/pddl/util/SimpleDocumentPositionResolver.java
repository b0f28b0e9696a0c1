package pddl.util;

import java.util.Arrays;

/**
 * Position resolver over an in-memory document text. Line start offsets are
 * computed once; each lookup is a binary search over them.
 */
public class SimpleDocumentPositionResolver extends DocumentPositionResolver {

	// offset at which each line starts; a line includes its '\n' separator
	private final int[] lineStarts;
	// one past the offset of the last addressable position, i.e. text length + 1
	private final int limit;

	public SimpleDocumentPositionResolver(CharSequence documentText) {
		int lines = 1;
		for (int i = 0; i < documentText.length(); i++) {
			if (documentText.charAt(i) == '\n') {
				lines++;
			}
		}
		this.lineStarts = new int[lines];
		int line = 1;
		for (int i = 0; i < documentText.length(); i++) {
			if (documentText.charAt(i) == '\n') {
				lineStarts[line++] = i + 1;
			}
		}
		this.limit = documentText.length() + 1;
	}

	@Override
	public PddlPosition resolveToPosition(int offset) {
		if (offset < 0 || offset >= limit) {
			throw new OffsetOutOfRangeException(offset, limit - 1);
		}
		int found = Arrays.binarySearch(lineStarts, offset);
		// for a miss binarySearch returns -(insertion point) - 1, the owning line precedes the insertion point
		int lineIndex = found >= 0 ? found : -found - 2;
		return new PddlPosition(lineIndex, offset - lineStarts[lineIndex]);
	}

	public int getLineCount() {
		return lineStarts.length;
	}
}
