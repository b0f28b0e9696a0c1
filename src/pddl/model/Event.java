package pddl.model;

import java.util.List;

import pddl.parser.PddlBracketNode;

/**
 * `(:event name ...)`, a discrete change triggered when its precondition becomes true.
 */
public class Event extends PreconditionEffectConstruct {

	public Event(String name, List<Parameter> parameters, PddlBracketNode node,
			PddlBracketNode precondition, PddlBracketNode effect) {
		super(name, parameters, node, precondition, effect);
	}

	@Override
	public <T, E extends Throwable> T accept(DomainConstructVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
