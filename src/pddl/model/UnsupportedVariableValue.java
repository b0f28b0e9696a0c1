package pddl.model;

/**
 * An `:init` entry that could not be interpreted; the text is kept as the variable name.
 */
public class UnsupportedVariableValue extends VariableValue {

	public UnsupportedVariableValue(String text) {
		super(text, false);
	}

	@Override
	public VariableValue negate() {
		return this;
	}

	@Override
	public boolean isSupported() {
		return false;
	}
}
