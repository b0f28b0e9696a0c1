package pddl.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Directed graph over string vertices, keeping vertices and edges in insertion order.
 * Used for the type inheritance (child -> parent) relation.
 */
public class DirectionalGraph {

	private final Map<String, List<String>> verticesAndEdges = new LinkedHashMap<>();

	public List<String> getVertices() {
		return new ArrayList<>(verticesAndEdges.keySet());
	}

	public List<Pair<String, String>> getEdges() {
		List<Pair<String, String>> edges = new ArrayList<>();
		verticesAndEdges.forEach((from, targets) -> targets.forEach(to -> edges.add(new Pair<>(from, to))));
		return edges;
	}

	/**
	 * Adds an edge, creating both vertices as needed.
	 *
	 * @param from source vertex
	 * @param to target vertex, or null to only add the source vertex
	 * @return this graph
	 */
	public DirectionalGraph addEdge(String from, String to) {
		List<String> targets = verticesAndEdges.computeIfAbsent(from, v -> new ArrayList<>());
		if (to != null) {
			if (!targets.contains(to)) {
				targets.add(to);
			}
			verticesAndEdges.computeIfAbsent(to, v -> new ArrayList<>());
		}
		return this;
	}

	public List<String> getVerticesWithEdgesFrom(String vertex) {
		List<String> targets = verticesAndEdges.get(vertex);
		return targets == null ? Collections.emptyList() : Collections.unmodifiableList(targets);
	}

	public List<String> getVerticesWithEdgesTo(String vertex) {
		return verticesAndEdges.entrySet().stream()
				.filter(entry -> entry.getValue().contains(vertex))
				.map(Map.Entry::getKey)
				.collect(Collectors.toList());
	}

	/**
	 * @return all vertices from which vertex can be reached, nearest first, each once
	 */
	public List<String> getSubtreePointingTo(String vertex) {
		return getSubtree(vertex, this::getVerticesWithEdgesTo);
	}

	/**
	 * @return all vertices reachable from vertex, nearest first, each once
	 */
	public List<String> getSubtreePointingFrom(String vertex) {
		return getSubtree(vertex, this::getVerticesWithEdgesFrom);
	}

	private static List<String> getSubtree(String vertex, Function<String, List<String>> neighbours) {
		Set<String> visited = new HashSet<>();
		visited.add(vertex);
		return getSubtree(vertex, neighbours, visited);
	}

	// the visited set stops cycles such as `a - b b - a`
	private static List<String> getSubtree(String vertex, Function<String, List<String>> neighbours,
			Set<String> visited) {
		List<String> vertices = new ArrayList<>();
		for (String neighbour : neighbours.apply(vertex)) {
			if (visited.add(neighbour)) {
				vertices.add(neighbour);
			}
		}
		List<String> subtree = new ArrayList<>(vertices);
		for (String neighbour : vertices) {
			subtree.addAll(getSubtree(neighbour, neighbours, visited));
		}
		return subtree;
	}
}
