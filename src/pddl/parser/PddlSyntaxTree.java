package pddl.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import pddl.lexer.PddlToken;
import pddl.util.OffsetOutOfRangeException;

/**
 * Syntax tree of one PDDL document. The root is a DOCUMENT node spanning the whole text.
 */
public class PddlSyntaxTree {

	private final PddlSyntaxNode root;

	PddlSyntaxTree(PddlSyntaxNode root) {
		this.root = root;
	}

	public static PddlSyntaxTree empty() {
		return new PddlSyntaxTree(PddlSyntaxNode.createRoot());
	}

	public PddlSyntaxNode getRootNode() {
		return root;
	}

	/**
	 * @return the `(define ...)` bracket, if the document has one at the top level
	 */
	public Optional<PddlBracketNode> getDefineNode() {
		return root.getFirstOpenBracket("define");
	}

	public PddlBracketNode getDefineNodeOrThrow() {
		return getDefineNode()
				.orElseThrow(() -> new IllegalStateException("Document does not contain the '(define' node."));
	}

	/**
	 * Finds the innermost node at the given offset.
	 *
	 * @param offset index in the document text
	 * @throws OffsetOutOfRangeException if the offset is outside the document
	 */
	public PddlSyntaxNode getNodeAt(int offset) {
		if (!root.includesIndex(offset)) {
			throw new OffsetOutOfRangeException(offset, root.getEnd());
		}
		PddlSyntaxNode node = root;
		while (node.hasChildren()) {
			// the open bracket (or operator) token itself
			if (!node.isRoot() && node.getToken().includesIndex(offset)) {
				return node;
			}
			// an offset between two siblings belongs to the one that starts there
			PddlSyntaxNode next = null;
			for (PddlSyntaxNode child : node.getChildren()) {
				if (child.includesIndex(offset)) {
					next = child;
				} else if (next != null) {
					break;
				}
			}
			if (next == null) {
				// e.g. the offset of a close bracket, which is not a child
				return node;
			}
			node = next;
		}
		return node;
	}

	/**
	 * @return tokens of the nodes from the root down to the node at offset
	 */
	public List<PddlToken> getBreadcrumbs(int offset) {
		List<PddlToken> breadcrumbs = new ArrayList<>();
		PddlSyntaxNode node = getNodeAt(offset);
		while (node != null) {
			breadcrumbs.add(node.getToken());
			node = node.getParent();
		}
		Collections.reverse(breadcrumbs);
		return breadcrumbs;
	}
}
