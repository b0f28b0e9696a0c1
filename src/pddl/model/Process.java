package pddl.model;

import java.util.List;

import pddl.parser.PddlBracketNode;

/**
 * `(:process name ...)`, a continuous change active while its precondition holds.
 */
public class Process extends PreconditionEffectConstruct {

	public Process(String name, List<Parameter> parameters, PddlBracketNode node,
			PddlBracketNode precondition, PddlBracketNode effect) {
		super(name, parameters, node, precondition, effect);
	}

	@Override
	public <T, E extends Throwable> T accept(DomainConstructVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
