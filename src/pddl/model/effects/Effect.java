package pddl.model.effects;

import pddl.parser.PddlSyntaxNode;

/**
 * A single effect of an action, process or event, backed by its syntax node.
 */
public abstract class Effect {

	private final PddlSyntaxNode node;

	protected Effect(PddlSyntaxNode node) {
		this.node = node;
	}

	public PddlSyntaxNode getNode() {
		return node;
	}

	public String toPddlString() {
		return node.getText();
	}

	public abstract <T, E extends Throwable> T accept(EffectVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getClass().getSimpleName() + " " + toPddlString();
	}
}
