package pddl.model;

public abstract class DomainConstructVisitor<T, E extends Throwable> {
	public abstract T visit(InstantAction instantAction) throws E;
	public abstract T visit(DurativeAction durativeAction) throws E;
	public abstract T visit(Process process) throws E;
	public abstract T visit(Event event) throws E;
	public abstract T visit(UnrecognizedStructure unrecognizedStructure) throws E;
}
