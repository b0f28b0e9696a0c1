package pddl.model.effects;

import pddl.model.Variable;
import pddl.parser.PddlSyntaxNode;

/**
 * An effect that changes the value of one state variable.
 */
public abstract class VariableEffect extends Effect {

	private final Variable variableModified;

	protected VariableEffect(PddlSyntaxNode node, Variable variableModified) {
		super(node);
		this.variableModified = variableModified;
	}

	public Variable getVariableModified() {
		return variableModified;
	}

	/**
	 * Compares by variable name only, ignoring case and arguments.
	 */
	public boolean modifies(Variable variable) {
		return variableModified.matchesShortNameCaseInsensitive(variable.getName());
	}
}
