package pddl.model;

import java.util.List;
import java.util.Optional;

import pddl.parser.PddlBracketNode;

/**
 * `(:durative-action name :parameters (...) :duration (...) :condition (...) :effect (...))`
 */
public class DurativeAction extends DomainConstruct {

	private final PddlBracketNode duration;
	private final PddlBracketNode condition;
	private final PddlBracketNode effect;

	public DurativeAction(String name, List<Parameter> parameters, PddlBracketNode node,
			PddlBracketNode duration, PddlBracketNode condition, PddlBracketNode effect) {
		super(name, parameters, node);
		this.duration = duration;
		this.condition = condition;
		this.effect = effect;
	}

	public Optional<PddlBracketNode> getDuration() {
		return Optional.ofNullable(duration);
	}

	public Optional<PddlBracketNode> getCondition() {
		return Optional.ofNullable(condition);
	}

	public Optional<PddlBracketNode> getEffect() {
		return Optional.ofNullable(effect);
	}

	@Override
	public boolean isDurative() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(DomainConstructVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
