package pddl.model;

import java.util.Locale;

import pddl.parser.PddlSyntaxNode;

/**
 * `(:metric minimize (total-time))`
 */
public class Metric {

	public enum Direction {
		MINIMIZE,
		MAXIMIZE,
		UNKNOWN,
	}

	private final Direction direction;
	private final PddlSyntaxNode expression;

	public Metric(Direction direction, PddlSyntaxNode expression) {
		this.direction = direction;
		this.expression = expression;
	}

	public Direction getDirection() {
		return direction;
	}

	public PddlSyntaxNode getExpression() {
		return expression;
	}

	public String getExpressionText() {
		return expression.getText();
	}

	@Override
	public String toString() {
		return direction.name().toLowerCase(Locale.ROOT) + " " + getExpressionText();
	}
}
