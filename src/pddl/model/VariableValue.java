package pddl.model;

import java.util.Objects;

/**
 * Value of a grounded variable, e.g. `at plane1 city2` = true or `fuel plane1` = 100.
 * The value is either a Boolean or a Double.
 */
public class VariableValue {

	private final String variableName;
	private final Object value;

	public VariableValue(String variableName, boolean value) {
		this(variableName, (Object) value);
	}

	public VariableValue(String variableName, double value) {
		this(variableName, (Object) value);
	}

	protected VariableValue(String variableName, Object value) {
		this.variableName = variableName;
		this.value = value;
	}

	public String getVariableName() {
		return variableName;
	}

	/**
	 * @return a Boolean for predicates, a Double for functions
	 */
	public Object getValue() {
		return value;
	}

	public boolean isNumeric() {
		return value instanceof Double;
	}

	/**
	 * @throws IllegalStateException for a numeric value
	 */
	public VariableValue negate() {
		if (isNumeric()) {
			throw new IllegalStateException("Cannot negate numeric value of '" + variableName + "'.");
		}
		return new VariableValue(variableName, !(Boolean) value);
	}

	public boolean isSupported() {
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(variableName, value, isSupported());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		VariableValue other = (VariableValue) obj;
		return variableName.equals(other.variableName) && Objects.equals(value, other.value);
	}

	@Override
	public String toString() {
		return variableName + "=" + value;
	}
}
