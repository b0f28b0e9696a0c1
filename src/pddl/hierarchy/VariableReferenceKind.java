package pddl.hierarchy;

public enum VariableReferenceKind {
	READ,
	READ_OR_WRITE,
	WRITE,
	UNRECOGNIZED,
}
