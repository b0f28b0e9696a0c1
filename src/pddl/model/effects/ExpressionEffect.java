package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

/**
 * A numeric effect `(op (f ?x) expression)`.
 */
public abstract class ExpressionEffect extends VariableEffect {

	private final PddlSyntaxNode expressionNode;

	protected ExpressionEffect(PddlSyntaxNode node, Variable variableModified, PddlSyntaxNode expressionNode) {
		super(node, variableModified);
		this.expressionNode = expressionNode;
	}

	public PddlSyntaxNode getExpressionNode() {
		return expressionNode;
	}

	/**
	 * @return the right-hand side, e.g. `3` or `(* #t (rate ?x))`
	 */
	public String getExpressionText() {
		return expressionNode.getText();
	}
}
