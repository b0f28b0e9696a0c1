package pddl.model.effects;

import pddl.parser.PddlSyntaxNode;

/**
 * An effect the parser could not interpret, e.g. a conditional effect or a malformed `(not)`.
 */
public class UnrecognizedEffect extends Effect {

	public UnrecognizedEffect(PddlSyntaxNode node) {
		super(node);
	}

	@Override
	public <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
