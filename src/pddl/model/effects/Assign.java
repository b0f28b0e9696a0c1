package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

public class Assign extends ExpressionEffect {

	public Assign(PddlSyntaxNode node, Variable variableModified, PddlSyntaxNode expressionNode) {
		super(node, variableModified, expressionNode);
	}

	@Override
	public <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
