package pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import pddl.lexer.PddlTokenType;
import pddl.model.constraints.Constraint;
import pddl.parser.PddlBracketNode;
import pddl.parser.PddlSyntaxNode;
import pddl.parser.PddlSyntaxTree;
import pddl.util.DirectionalGraph;
import pddl.util.DocumentPositionResolver;
import pddl.util.PddlRange;

/**
 * Domain file.
 */
public class DomainInfo extends FileInfo {

	public static final String OBJECT = "object";

	private final PddlSyntaxTree syntaxTree;
	private List<Variable> predicates = Collections.emptyList();
	private List<Variable> functions = Collections.emptyList();
	private List<Variable> derived = Collections.emptyList();
	private List<DomainConstruct> actions = Collections.emptyList();
	private List<DomainConstruct> processes = Collections.emptyList();
	private List<DomainConstruct> events = Collections.emptyList();
	private DirectionalGraph typeInheritance = new DirectionalGraph();
	private final Map<String, PddlRange> typeLocations = new LinkedHashMap<>();
	private TypeObjectMap constants = new TypeObjectMap();
	private List<Constraint> constraints = Collections.emptyList();

	public DomainInfo(String fileUri, int version, String domainName, PddlSyntaxTree syntaxTree,
			DocumentPositionResolver positionResolver) {
		super(fileUri, version, domainName, positionResolver);
		this.syntaxTree = syntaxTree;
	}

	public PddlSyntaxTree getSyntaxTree() {
		return syntaxTree;
	}

	@Override
	public boolean isDomain() {
		return true;
	}

	public List<Variable> getPredicates() {
		return predicates;
	}

	public void setPredicates(List<Variable> predicates) {
		this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
	}

	public List<Variable> getFunctions() {
		return functions;
	}

	public void setFunctions(List<Variable> functions) {
		this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
	}

	public Optional<Variable> getFunction(String liftedVariableName) {
		return functions.stream()
				.filter(variable -> variable.matchesShortNameCaseInsensitive(liftedVariableName))
				.findFirst();
	}

	public Optional<Variable> getLiftedFunction(Variable groundedVariable) {
		return getFunction(groundedVariable.getName());
	}

	public List<Variable> getDerived() {
		return derived;
	}

	public void setDerived(List<Variable> derived) {
		this.derived = Collections.unmodifiableList(new ArrayList<>(derived));
	}

	/**
	 * @return instantaneous and durative actions, in that order
	 */
	public List<DomainConstruct> getActions() {
		return actions;
	}

	public void setActions(List<DomainConstruct> actions) {
		this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
	}

	public List<DomainConstruct> getProcesses() {
		return processes;
	}

	public void setProcesses(List<DomainConstruct> processes) {
		this.processes = Collections.unmodifiableList(new ArrayList<>(processes));
	}

	public List<DomainConstruct> getEvents() {
		return events;
	}

	public void setEvents(List<DomainConstruct> events) {
		this.events = Collections.unmodifiableList(new ArrayList<>(events));
	}

	/**
	 * @return actions, processes and events
	 */
	public List<DomainConstruct> getStructures() {
		List<DomainConstruct> structures = new ArrayList<>(actions);
		structures.addAll(processes);
		structures.addAll(events);
		return structures;
	}

	public DirectionalGraph getTypeInheritance() {
		return typeInheritance;
	}

	/**
	 * Sets the type graph and records where each type is declared in the `(:types ...)` section.
	 */
	public void setTypeInheritance(DirectionalGraph typeInheritance, PddlBracketNode typesNode) {
		this.typeInheritance = typeInheritance;
		typeLocations.clear();
		if (typesNode == null) {
			return;
		}
		for (String typeName : getTypes()) {
			Pattern pattern = Pattern.compile("^" + Pattern.quote(typeName) + "$");
			typesNode.getFirstChild(PddlTokenType.OTHER, pattern)
					.ifPresent(typeNode -> typeLocations.put(typeName, getRange(typeNode)));
		}
	}

	/**
	 * @return declared types, excluding `object`
	 */
	public List<String> getTypes() {
		return typeInheritance.getVertices().stream()
				.filter(t -> !t.toLowerCase(Locale.ROOT).equals(OBJECT))
				.collect(Collectors.toList());
	}

	public List<String> getTypesInclObject() {
		return typeInheritance.getVertices();
	}

	/**
	 * @return all direct and indirect subtypes of the type
	 */
	public List<String> getTypesInheritingFrom(String type) {
		return typeInheritance.getSubtreePointingTo(type);
	}

	public Optional<PddlRange> getTypeLocation(String type) {
		return Optional.ofNullable(typeLocations.get(type));
	}

	public TypeObjectMap getConstants() {
		return constants;
	}

	public void setConstants(TypeObjectMap constants) {
		if (constants == null) {
			throw new IllegalArgumentException("Constants must be defined or empty.");
		}
		this.constants = constants;
	}

	public List<Constraint> getConstraints() {
		return constraints;
	}

	public void setConstraints(List<Constraint> constraints) {
		this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
	}

	/**
	 * @return ranges of every plain bracket whose first symbol is the variable name
	 */
	@Override
	public List<PddlRange> getVariableReferences(Variable variable) {
		List<PddlRange> referenceLocations = new ArrayList<>();
		for (PddlSyntaxNode node : getVariableReferenceNodes(variable)) {
			referenceLocations.add(getRange(node));
		}
		return referenceLocations;
	}

	/**
	 * Same as {@link #getVariableReferences(Variable)}, but returning the bracket nodes.
	 * An `(at ...)` reference is a bracket fused with the `at` operator, so any
	 * bracket whose head symbol matches counts.
	 */
	public List<PddlSyntaxNode> getVariableReferenceNodes(Variable variable) {
		List<PddlSyntaxNode> nodes = new ArrayList<>();
		Optional<PddlBracketNode> defineNode = syntaxTree.getDefineNode();
		if (!defineNode.isPresent()) {
			return nodes;
		}
		defineNode.get().getChildrenRecursively(node -> isVariableReference(node, variable), nodes::add);
		return nodes;
	}

	private static boolean isVariableReference(PddlSyntaxNode node, Variable variable) {
		if (!node.isOpenBracket()) {
			return false;
		}
		PddlBracketNode bracket = (PddlBracketNode) node;
		if (bracket.getOperator().startsWith(":")) {
			return false;
		}
		return variable.matchesShortNameCaseInsensitive(bracket.getHeadSymbol())
				&& !bracket.getHeadSymbol().isEmpty();
	}
}
