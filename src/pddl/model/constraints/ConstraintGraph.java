package pddl.model.constraints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import pddl.model.DomainInfo;
import pddl.model.ProblemInfo;
import pddl.util.DirectionalGraph;
import pddl.util.Pair;

/**
 * Orders the named conditions of a domain and its problem by their `after` and
 * `strictly-after` constraints.
 *
 * Vertices are keyed by condition name, or by condition text for inline
 * conditions. An `after` operand naming a condition nobody declared still gets
 * a vertex, just without a condition.
 */
public class ConstraintGraph {

	static final String UNNAMED = "unnamed";

	private final Map<String, NamedConditionConstraint> conditions = new LinkedHashMap<>();
	private final DirectionalGraph ordering = new DirectionalGraph();
	private final Set<Pair<String, String>> strictEdges = new LinkedHashSet<>();
	private final List<Constraint> unrecognized = new ArrayList<>();

	public ConstraintGraph(List<Constraint> constraints) {
		List<AfterConstraint> afterConstraints = new ArrayList<>();
		for (Constraint constraint : constraints) {
			constraint.accept(new ConstraintVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(NamedConditionConstraint namedConditionConstraint) throws RuntimeException {
					addCondition(namedConditionConstraint);
					return null;
				}

				@Override
				public Void visit(AfterConstraint afterConstraint) throws RuntimeException {
					afterConstraints.add(afterConstraint);
					return null;
				}

				@Override
				public Void visit(UnrecognizedConstraint unrecognizedConstraint) throws RuntimeException {
					unrecognized.add(unrecognizedConstraint);
					return null;
				}
			});
		}

		// after constraints may refer to conditions named further down
		for (AfterConstraint after : afterConstraints) {
			String from = upsert(after.getPredecessor());
			String to = upsert(after.getSuccessor());
			ordering.addEdge(from, to);
			if (after.isStrict()) {
				strictEdges.add(new Pair<>(from, to));
			}
		}
	}

	/**
	 * Domain constraints first, then the problem's.
	 */
	public static ConstraintGraph of(DomainInfo domainInfo, ProblemInfo problemInfo) {
		List<Constraint> constraints = new ArrayList<>(domainInfo.getConstraints());
		constraints.addAll(problemInfo.getConstraints());
		return new ConstraintGraph(constraints);
	}

	private static String keyOf(NamedConditionConstraint namedCondition) {
		return namedCondition.getName()
				.orElseGet(() -> namedCondition.getCondition().map(Condition::getText).orElse(UNNAMED));
	}

	private String addCondition(NamedConditionConstraint namedCondition) {
		String key = keyOf(namedCondition);
		conditions.put(key, namedCondition);
		ordering.addEdge(key, null);
		return key;
	}

	private String upsert(NamedConditionConstraint operand) {
		String key = keyOf(operand);
		if (conditions.containsKey(key)) {
			return key;
		}
		return addCondition(operand);
	}

	/**
	 * @return condition keys in declaration order
	 */
	public List<String> getConditions() {
		return ordering.getVertices();
	}

	public Optional<Condition> getCondition(String key) {
		NamedConditionConstraint namedCondition = conditions.get(key);
		return namedCondition == null ? Optional.empty() : namedCondition.getCondition();
	}

	public List<String> getSuccessors(String key) {
		return ordering.getVerticesWithEdgesFrom(key);
	}

	public List<String> getPredecessors(String key) {
		return ordering.getVerticesWithEdgesTo(key);
	}

	/**
	 * @return (predecessor, successor) pairs
	 */
	public List<Pair<String, String>> getOrderings() {
		return ordering.getEdges();
	}

	public boolean isStrict(String predecessor, String successor) {
		return strictEdges.contains(new Pair<>(predecessor, successor));
	}

	/**
	 * @return constraints that neither name a condition nor order two
	 */
	public List<Constraint> getUnrecognized() {
		return Collections.unmodifiableList(unrecognized);
	}
}
