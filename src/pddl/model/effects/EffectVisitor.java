package pddl.model.effects;

public abstract class EffectVisitor<T, E extends Throwable> {
	public abstract T visit(MakeTrue makeTrue) throws E;
	public abstract T visit(MakeFalse makeFalse) throws E;
	public abstract T visit(Assign assign) throws E;
	public abstract T visit(Increase increase) throws E;
	public abstract T visit(Decrease decrease) throws E;
	public abstract T visit(ScaleUp scaleUp) throws E;
	public abstract T visit(ScaleDown scaleDown) throws E;
	public abstract T visit(UnrecognizedEffect unrecognizedEffect) throws E;
}
