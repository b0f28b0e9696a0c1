package pddl.model;

import java.util.Collections;

/**
 * Stands in where no construct encloses a reference.
 */
public class UnrecognizedStructure extends DomainConstruct {

	public UnrecognizedStructure() {
		super(null, Collections.emptyList(), null);
	}

	@Override
	public boolean isDurative() {
		return false;
	}

	@Override
	public <T, E extends Throwable> T accept(DomainConstructVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
