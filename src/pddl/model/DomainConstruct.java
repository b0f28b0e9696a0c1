package pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import pddl.parser.PddlBracketNode;
import pddl.util.PddlRange;

/**
 * An action, durative action, process or event declared in a domain.
 *
 * The node is the whole `(:action ...)` bracket; offsets inside it belong to this construct.
 */
public abstract class DomainConstruct {

	private final String name;
	private final List<Parameter> parameters;
	private final PddlBracketNode node;
	private PddlRange location;
	private List<String> documentation = Collections.emptyList();

	protected DomainConstruct(String name, List<Parameter> parameters, PddlBracketNode node) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.node = node;
	}

	public Optional<String> getName() {
		return Optional.ofNullable(name);
	}

	public String getNameOrEmpty() {
		return name != null ? name : "";
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * @return the declaring bracket, absent for {@link UnrecognizedStructure}
	 */
	public Optional<PddlBracketNode> getNode() {
		return Optional.ofNullable(node);
	}

	/**
	 * @param offset document offset
	 * @return true if the offset is inside the declaring bracket
	 */
	public boolean includesIndex(int offset) {
		return node != null && node.includesIndex(offset);
	}

	public Optional<PddlRange> getLocation() {
		return Optional.ofNullable(location);
	}

	public void setLocation(PddlRange location) {
		this.location = location;
	}

	public List<String> getDocumentation() {
		return documentation;
	}

	public void setDocumentation(List<String> documentation) {
		this.documentation = Collections.unmodifiableList(new ArrayList<>(documentation));
	}

	public abstract boolean isDurative();

	public abstract <T, E extends Throwable> T accept(DomainConstructVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getClass().getSimpleName() + " " + getNameOrEmpty();
	}
}
