package pddl.model;

import java.util.Objects;

public class ObjectInstance extends Term {

	private final String name;

	public ObjectInstance(String name, String type) {
		super(type);
		this.name = name;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public String toPddlString() {
		return name;
	}

	@Override
	public boolean isGrounded() {
		return true;
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
		ObjectInstance other = (ObjectInstance) obj;
		return name.equals(other.name) && Objects.equals(getType(), other.getType());
	}
}
