package pddl.model;

import java.util.List;
import java.util.Optional;

import pddl.parser.PddlBracketNode;

/**
 * Shape shared by instantaneous actions, processes and events: `:precondition` and `:effect`.
 */
public abstract class PreconditionEffectConstruct extends DomainConstruct {

	private final PddlBracketNode precondition;
	private final PddlBracketNode effect;

	protected PreconditionEffectConstruct(String name, List<Parameter> parameters, PddlBracketNode node,
			PddlBracketNode precondition, PddlBracketNode effect) {
		super(name, parameters, node);
		this.precondition = precondition;
		this.effect = effect;
	}

	public Optional<PddlBracketNode> getPrecondition() {
		return Optional.ofNullable(precondition);
	}

	public Optional<PddlBracketNode> getEffect() {
		return Optional.ofNullable(effect);
	}

	@Override
	public boolean isDurative() {
		return false;
	}
}
