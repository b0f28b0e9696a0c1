package pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import pddl.model.constraints.Constraint;
import pddl.parser.PddlSyntaxNode;
import pddl.parser.PddlSyntaxTree;
import pddl.util.DocumentPositionResolver;

/**
 * Problem file.
 *
 * The problem structure is only available once parsed; the accessors fail
 * fast before that and again after {@link #update(int, String, boolean)}.
 */
public class ProblemInfo extends FileInfo {

	private final String domainName;
	private final PddlSyntaxTree syntaxTree;
	private TypeObjectMap objects = new TypeObjectMap();
	private List<TimedVariableValue> inits = Collections.emptyList();
	private List<SupplyDemand> supplyDemands = Collections.emptyList();
	private List<Constraint> constraints = Collections.emptyList();
	private PddlSyntaxNode goal;
	private Metric metric;

	public ProblemInfo(String fileUri, int version, String problemName, String domainName,
			PddlSyntaxTree syntaxTree, DocumentPositionResolver positionResolver) {
		super(fileUri, version, problemName, positionResolver);
		this.domainName = domainName;
		this.syntaxTree = syntaxTree;
		setStatus(FileStatus.DIRTY);
	}

	@Override
	public boolean isProblem() {
		return true;
	}

	public String getDomainName() {
		return domainName;
	}

	public PddlSyntaxTree getSyntaxTree() {
		return syntaxTree;
	}

	private void checkParsed() {
		if (getStatus() != FileStatus.PARSED) {
			throw new IllegalStateException("Problem '" + getName() + "' is not parsed yet.");
		}
	}

	public TypeObjectMap getObjectsPerType() {
		checkParsed();
		return objects;
	}

	public List<String> getObjects(String type) {
		checkParsed();
		return objects.getTypeCaseInsensitive(type)
				.map(TypeObjects::getObjects)
				.orElse(Collections.emptyList());
	}

	public void setObjects(TypeObjectMap objects) {
		this.objects = objects;
	}

	/**
	 * @return initial values and timed initial literals/fluents, excluding supply-demand contracts
	 */
	public List<TimedVariableValue> getInits() {
		checkParsed();
		return inits;
	}

	public void setInits(List<TimedVariableValue> inits) {
		this.inits = Collections.unmodifiableList(new ArrayList<>(inits));
	}

	public List<SupplyDemand> getSupplyDemands() {
		checkParsed();
		return supplyDemands;
	}

	public void setSupplyDemands(List<SupplyDemand> supplyDemands) {
		this.supplyDemands = Collections.unmodifiableList(new ArrayList<>(supplyDemands));
	}

	public List<Constraint> getConstraints() {
		checkParsed();
		return constraints;
	}

	public void setConstraints(List<Constraint> constraints) {
		this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
	}

	/**
	 * @return the goal condition, e.g. `(and (at p1 city2))`
	 */
	public Optional<PddlSyntaxNode> getGoal() {
		checkParsed();
		return Optional.ofNullable(goal);
	}

	public void setGoal(PddlSyntaxNode goal) {
		this.goal = goal;
	}

	public Optional<Metric> getMetric() {
		checkParsed();
		return Optional.ofNullable(metric);
	}

	public void setMetric(Metric metric) {
		this.metric = metric;
	}
}
