package pddl.model;

/**
 * Supply-demand contract declared in `:init`.
 */
public class SupplyDemand {

	private final String name;

	public SupplyDemand(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return name;
	}
}
