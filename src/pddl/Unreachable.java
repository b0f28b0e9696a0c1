package pddl;

public class Unreachable extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
