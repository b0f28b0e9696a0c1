package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

/**
 * Sets a predicate to false, e.g. `(not (at ?p ?from))`.
 */
public class MakeFalse extends VariableEffect {

	public MakeFalse(PddlSyntaxNode node, Variable variableModified) {
		super(node, variableModified);
	}

	@Override
	public <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
