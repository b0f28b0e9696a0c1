package pddl.model.constraints;

import pddl.parser.PddlSyntaxNode;

public class Condition {

	private final PddlSyntaxNode node;

	public Condition(PddlSyntaxNode node) {
		this.node = node;
	}

	public PddlSyntaxNode getNode() {
		return node;
	}

	public String getText() {
		return node.getText();
	}

	@Override
	public String toString() {
		return getText();
	}
}
