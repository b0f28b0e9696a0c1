package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

public class ScaleDown extends ExpressionEffect {

	public ScaleDown(PddlSyntaxNode node, Variable variableModified, PddlSyntaxNode expressionNode) {
		super(node, variableModified, expressionNode);
	}

	@Override
	public <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
