package pddl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import pddl.lexer.PddlTokenType;
import pddl.model.constraints.AfterConstraint;
import pddl.model.constraints.Condition;
import pddl.model.constraints.Constraint;
import pddl.model.constraints.NamedConditionConstraint;
import pddl.model.constraints.UnrecognizedConstraint;

/**
 * Parses the content of a domain or problem `(:constraints ...)` section.
 */
public class PddlConstraintsParser {

	public List<Constraint> parseConstraints(PddlSyntaxNode constraintsNode) {
		List<PddlSyntaxNode> children = new ArrayList<>();
		for (PddlSyntaxNode child : constraintsNode.getNonWhitespaceNonCommentChildren()) {
			if (child.isOpenBracket()) {
				children.add(child);
			}
		}

		if (children.isEmpty()) {
			return new ArrayList<>();
		}

		if (children.size() == 1 && ((PddlBracketNode) children.get(0)).isOperator("and")) {
			return parseConstraints(children.get(0));
		}

		List<Constraint> constraints = new ArrayList<>();
		for (PddlSyntaxNode child : children) {
			constraints.add(parseChild((PddlBracketNode) child));
		}
		return constraints;
	}

	private Constraint parseChild(PddlBracketNode node) {
		List<PddlSyntaxNode> children = node.getNonWhitespaceNonCommentChildren();
		if (children.isEmpty() || !node.isType(PddlTokenType.OPEN_BRACKET)
				|| children.get(0).isNotType(PddlTokenType.OTHER)) {
			return new UnrecognizedConstraint(node);
		}

		List<PddlSyntaxNode> arguments = children.subList(1, children.size());
		Constraint constraint = null;
		switch (children.get(0).getToken().getText().toLowerCase(Locale.ROOT)) {
			case "name":
			case "named-condition":
			case "state-satisfying":
				constraint = parseNamedCondition(node, arguments);
				break;
			case "after":
				constraint = parseAfter(node, arguments, false);
				break;
			case "strictly-after":
				constraint = parseAfter(node, arguments, true);
				break;
			default:
				break;
		}
		return constraint != null ? constraint : new UnrecognizedConstraint(node);
	}

	private NamedConditionConstraint parseNamedCondition(PddlSyntaxNode constraintNode, List<PddlSyntaxNode> arguments) {
		if (arguments.size() < 2 || arguments.get(0).isNotType(PddlTokenType.OTHER) || !arguments.get(1).isOpenBracket()) {
			return null;
		}
		String name = arguments.get(0).getText();
		return new NamedConditionConstraint(name, new Condition(arguments.get(1)), constraintNode);
	}

	private AfterConstraint parseAfter(PddlSyntaxNode constraintNode, List<PddlSyntaxNode> arguments, boolean strict) {
		if (arguments.size() < 2) {
			return null;
		}
		NamedConditionConstraint predecessor = parseAfterOperand(arguments.get(0));
		NamedConditionConstraint successor = parseAfterOperand(arguments.get(1));
		if (predecessor == null || successor == null) {
			return null;
		}
		return new AfterConstraint(predecessor, successor, strict, constraintNode);
	}

	/**
	 * @return a name-only or condition-only operand, or null for anything else
	 */
	private NamedConditionConstraint parseAfterOperand(PddlSyntaxNode nameOrCondition) {
		if (nameOrCondition.isType(PddlTokenType.OTHER)) {
			return new NamedConditionConstraint(nameOrCondition.getText(), null, nameOrCondition);
		}
		if (nameOrCondition.isOpenBracket()) {
			return new NamedConditionConstraint(null, new Condition(nameOrCondition), nameOrCondition);
		}
		return null;
	}
}
