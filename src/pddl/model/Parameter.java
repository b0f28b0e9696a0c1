package pddl.model;

import java.util.Objects;

public class Parameter extends Term {

	private final String name;

	/**
	 * @param name parameter name without the `?` sign
	 */
	public Parameter(String name, String type) {
		super(type);
		this.name = name;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public String toPddlString() {
		return "?" + name + " - " + getType();
	}

	@Override
	public boolean isGrounded() {
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, getType());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Parameter other = (Parameter) obj;
		return name.equals(other.name) && Objects.equals(getType(), other.getType());
	}
}
