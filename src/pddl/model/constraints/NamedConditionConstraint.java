package pddl.model.constraints;

import java.util.Optional;

import pddl.parser.PddlSyntaxNode;

/**
 * `(name g1 (condition))`, or one operand of an `after` constraint, which carries
 * either just the name of a condition declared elsewhere or just an inline condition.
 */
public class NamedConditionConstraint extends Constraint {

	private final String name;
	private final Condition condition;

	public NamedConditionConstraint(String name, Condition condition, PddlSyntaxNode node) {
		super(node);
		this.name = name;
		this.condition = condition;
	}

	public Optional<String> getName() {
		return Optional.ofNullable(name);
	}

	public Optional<Condition> getCondition() {
		return Optional.ofNullable(condition);
	}

	@Override
	public <T, E extends Throwable> T accept(ConstraintVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
