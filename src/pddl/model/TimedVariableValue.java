package pddl.model;

import java.util.Objects;

/**
 * Variable value effective from a certain time, e.g. an initial value or a timed initial literal.
 */
public class TimedVariableValue {

	private final double time;
	private final VariableValue value;

	public TimedVariableValue(double time, VariableValue value) {
		this.time = time;
		this.value = value;
	}

	public double getTime() {
		return time;
	}

	public String getVariableName() {
		return value.getVariableName();
	}

	/**
	 * @return the variable name without arguments
	 */
	public String getLiftedVariableName() {
		return getVariableName().split(" ", 2)[0];
	}

	public Object getValue() {
		return value.getValue();
	}

	public VariableValue getVariableValue() {
		return value;
	}

	public boolean isSupported() {
		return value.isSupported();
	}

	/**
	 * Compares variable name and value, ignoring the time.
	 */
	public boolean sameValue(TimedVariableValue other) {
		return getVariableName().equals(other.getVariableName()) && Objects.equals(getValue(), other.getValue());
	}

	@Override
	public int hashCode() {
		return Objects.hash(time, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TimedVariableValue other = (TimedVariableValue) obj;
		return Double.compare(time, other.time) == 0 && value.equals(other.value);
	}

	@Override
	public String toString() {
		return getVariableName() + "=" + getValue() + " @ " + time;
	}
}
