package pddl.model.constraints;

import pddl.parser.PddlSyntaxNode;

/**
 * `(after g1 g2)` or `(strictly-after g1 g2)`: g2 must hold after g1 held.
 */
public class AfterConstraint extends Constraint {

	private final NamedConditionConstraint predecessor;
	private final NamedConditionConstraint successor;
	private final boolean strict;

	public AfterConstraint(NamedConditionConstraint predecessor, NamedConditionConstraint successor,
			boolean strict, PddlSyntaxNode node) {
		super(node);
		this.predecessor = predecessor;
		this.successor = successor;
		this.strict = strict;
	}

	public NamedConditionConstraint getPredecessor() {
		return predecessor;
	}

	public NamedConditionConstraint getSuccessor() {
		return successor;
	}

	public boolean isStrict() {
		return strict;
	}

	@Override
	public <T, E extends Throwable> T accept(ConstraintVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
