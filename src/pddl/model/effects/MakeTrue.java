package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

/**
 * Sets a predicate to true, e.g. `(at ?p ?to)`.
 */
public class MakeTrue extends VariableEffect {

	public MakeTrue(PddlSyntaxNode node, Variable variableModified) {
		super(node, variableModified);
	}

	@Override
	public <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
