package pddl.model;

/**
 * A typed argument of a variable: either a parameter `?x - type` or a bound object.
 */
public abstract class Term {

	private final String type;

	protected Term(String type) {
		this.type = type;
	}

	public String getType() {
		return type;
	}

	public abstract String getName();

	public abstract String toPddlString();

	public abstract boolean isGrounded();

	@Override
	public String toString() {
		return toPddlString();
	}
}
