package pddl.formatters;

import java.io.IOException;
import java.io.StringWriter;

import pddl.Unreachable;
import pddl.parser.PddlBracketNode;
import pddl.parser.PddlSyntaxNode;

/**
 * Dumps a syntax tree one node per line, indented by depth. Used for debugging.
 */
public class SyntaxTreeFormatter {

	private final IndentingWriter out;

	public SyntaxTreeFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void write(PddlSyntaxNode node) throws IOException {
		out.write(node.getToken().getType().toString());
		out.write(": '");
		out.write(escape(node.getToken().getText()));
		out.write("'");
		if (node instanceof PddlBracketNode && !((PddlBracketNode) node).isClosed()) {
			out.write(" (unclosed)");
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (PddlSyntaxNode child : node.getChildren()) {
				out.newLine();
				write(child);
			}
		}
	}

	private static String escape(String text) {
		return text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
	}

	public static String format(PddlSyntaxNode node) {
		StringWriter w = new StringWriter();
		try {
			new SyntaxTreeFormatter(new IndentingWriter(w)).write(node);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}
}
