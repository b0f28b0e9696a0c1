package pddl.model;

public enum FileStatus {
	PARSED,
	DIRTY,
}
