package pddl.errors;

public abstract class ProblemContext {

	public abstract void error(ParsingProblem problem);

	public abstract boolean hasErrors();

	public void errors(Iterable<ParsingProblem> problems) {
		for (ParsingProblem problem : problems) {
			error(problem);
		}
	}
}
