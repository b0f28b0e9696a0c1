package pddl.hierarchy;

import pddl.model.UnrecognizedStructure;

/**
 * A reference outside of any action, process or event, e.g. in a predicate declaration.
 */
public class UnrecognizedVariableReferenceInfo extends VariableReferenceInfo {

	public UnrecognizedVariableReferenceInfo() {
		super(new UnrecognizedStructure(), null, ReferencePart.NONE, VariableReferenceKind.UNRECOGNIZED, "");
	}
}
