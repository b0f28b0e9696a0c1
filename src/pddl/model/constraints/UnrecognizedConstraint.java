package pddl.model.constraints;

import pddl.parser.PddlSyntaxNode;

/**
 * Any other constraint, e.g. `(always (p))` or an empty `()`. Kept so that nothing is dropped.
 */
public class UnrecognizedConstraint extends Constraint {

	public UnrecognizedConstraint(PddlSyntaxNode node) {
		super(node);
	}

	@Override
	public <T, E extends Throwable> T accept(ConstraintVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
