package pddl.hierarchy;

import java.util.Optional;

import pddl.model.DomainConstruct;
import pddl.parser.PddlBracketNode;

/**
 * How a variable is accessed at one reference. Computed on demand, never stored in the tree.
 */
public class VariableReferenceInfo {

	private final DomainConstruct structure;
	private final PddlBracketNode timeQualifierNode;
	private final ReferencePart part;
	private final VariableReferenceKind kind;
	private final String relevantCode;

	public VariableReferenceInfo(DomainConstruct structure, PddlBracketNode timeQualifierNode, ReferencePart part,
			VariableReferenceKind kind, String relevantCode) {
		this.structure = structure;
		this.timeQualifierNode = timeQualifierNode;
		this.part = part;
		this.kind = kind;
		this.relevantCode = relevantCode;
	}

	public DomainConstruct getStructure() {
		return structure;
	}

	public Optional<PddlBracketNode> getTimeQualifierNode() {
		return Optional.ofNullable(timeQualifierNode);
	}

	/**
	 * @return `at start`, `at end`, `over all`, or an empty string
	 */
	public String getTimeQualifier() {
		return timeQualifierNode != null ? timeQualifierNode.getOperator() : "";
	}

	public ReferencePart getPart() {
		return part;
	}

	public VariableReferenceKind getKind() {
		return kind;
	}

	/**
	 * @return the smallest expression that reads or writes the variable
	 */
	public String getRelevantCode() {
		return relevantCode;
	}

	@Override
	public String toString() {
		return "Accessed by structure `" + structure.getNameOrEmpty() + "` *" + getTimeQualifier() + "* " + part.getLabel();
	}
}
