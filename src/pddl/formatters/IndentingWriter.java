package pddl.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line with the current indentation.
 * Lines are always separated with '\n', regardless of the platform.
 */
public class IndentingWriter extends Writer {

	private static final char NEW_LINE = '\n';

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 2);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(NEW_LINE);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; i++) {
			char c = chars[i];
			if (shouldIndent) {
				for (int s = 0; s < indent; s++) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			out.write(c);
			if (c == NEW_LINE) {
				shouldIndent = true;
			}
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
