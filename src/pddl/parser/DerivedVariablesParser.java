package pddl.parser;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import pddl.lexer.PddlTokenType;
import pddl.model.Variable;
import pddl.util.DocumentPositionResolver;

/**
 * Parses `(:derived (p ?x ?y - type) condition)`.
 */
public class DerivedVariablesParser {

	private PddlSyntaxNode conditionNode;
	private Variable variable;

	public DerivedVariablesParser(PddlSyntaxNode derivedNode, DocumentPositionResolver positionResolver) {
		List<PddlSyntaxNode> children = derivedNode.getNonWhitespaceNonCommentChildren();
		if (children.size() != 2 || !children.get(0).isOpenBracket()) {
			return;
		}

		this.variable = VariablesParser.parseDeclaration((PddlBracketNode) children.get(0));
		this.conditionNode = children.get(1);
		variable.setLocation(positionResolver.resolveToRange(derivedNode));
		variable.setDocumentation(getDocumentationAbove(derivedNode));
	}

	public Optional<Variable> getVariable() {
		return Optional.ofNullable(variable);
	}

	public Optional<PddlSyntaxNode> getConditionNode() {
		return Optional.ofNullable(conditionNode);
	}

	/**
	 * Reads a `; comment` on the line directly above the node.
	 *
	 * @return the comment text without the semicolon, or nothing
	 */
	static List<String> getDocumentationAbove(PddlSyntaxNode node) {
		if (node.getParent() == null) {
			return Collections.emptyList();
		}
		List<PddlSyntaxNode> siblings = node.getParent().getChildren();
		int index = siblings.indexOf(node);

		int whitespaceIndex = index - 1;
		if (whitespaceIndex < 0 || siblings.get(whitespaceIndex).isNotType(PddlTokenType.WHITESPACE)) {
			return Collections.emptyList();
		}

		int commentIndex = whitespaceIndex - 1;
		if (commentIndex < 0 || siblings.get(commentIndex).isNotType(PddlTokenType.COMMENT)) {
			return Collections.emptyList();
		}
		return Collections.singletonList(siblings.get(commentIndex).getText().substring(1).trim());
	}
}
