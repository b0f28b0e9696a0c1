package pddl.model.constraints;

import pddl.parser.PddlSyntaxNode;

/**
 * A trajectory constraint from a `:constraints` section.
 */
public abstract class Constraint {

	private final PddlSyntaxNode node;

	protected Constraint(PddlSyntaxNode node) {
		this.node = node;
	}

	public PddlSyntaxNode getNode() {
		return node;
	}

	public abstract <T, E extends Throwable> T accept(ConstraintVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return node.getText();
	}
}
