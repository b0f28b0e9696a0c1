package pddl.model.constraints;

public abstract class ConstraintVisitor<T, E extends Throwable> {
	public abstract T visit(NamedConditionConstraint namedConditionConstraint) throws E;
	public abstract T visit(AfterConstraint afterConstraint) throws E;
	public abstract T visit(UnrecognizedConstraint unrecognizedConstraint) throws E;
}
