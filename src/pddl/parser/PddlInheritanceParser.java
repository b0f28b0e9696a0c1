package pddl.parser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pddl.model.DomainInfo;
import pddl.model.TypeObjectMap;
import pddl.util.DirectionalGraph;

/**
 * Parses `a b - parent c - other` lists of types or objects into a child -> parent graph.
 */
public class PddlInheritanceParser {

	private static final Pattern ENDS_WITH_TYPE = Pattern.compile("-\\s+\\w[\\w-]*\\s*$");
	private static final Pattern GROUP = Pattern.compile("(\\w[\\w-]*\\s+)+-\\s+\\w[\\w-]*");

	private PddlInheritanceParser() {}

	/**
	 * Names without a declared parent inherit from `object`.
	 */
	public static DirectionalGraph parseInheritance(String declarationText) {
		DirectionalGraph inheritance = new DirectionalGraph();

		if (declarationText == null || declarationText.trim().isEmpty()) {
			return inheritance;
		}

		if (!ENDS_WITH_TYPE.matcher(declarationText).find()) {
			declarationText += " - " + DomainInfo.OBJECT;
		}

		Matcher matcher = GROUP.matcher(declarationText);
		while (matcher.find()) {
			String[] fragments = matcher.group().split("\\s-");
			String parent = fragments.length > 1 ? fragments[1].trim() : null;
			for (String child : fragments[0].trim().split("\\s+")) {
				inheritance.addEdge(child, parent);
			}
		}

		// connect orphan types to the 'object' type
		for (String vertex : inheritance.getVertices()) {
			if (inheritance.getVerticesWithEdgesFrom(vertex).isEmpty() && !vertex.equals(DomainInfo.OBJECT)) {
				inheritance.addEdge(vertex, DomainInfo.OBJECT);
			}
		}

		return inheritance;
	}

	/**
	 * Groups the objects of an object -> type graph by type. Vertices that
	 * something points to are types, not objects.
	 */
	public static TypeObjectMap toTypeObjects(DirectionalGraph graph) {
		TypeObjectMap typeObjects = new TypeObjectMap();
		for (String vertex : graph.getVertices()) {
			if (!graph.getVerticesWithEdgesTo(vertex).isEmpty()) {
				continue;
			}
			List<String> types = graph.getVerticesWithEdgesFrom(vertex);
			for (String type : types) {
				typeObjects.add(type, vertex);
			}
		}
		return typeObjects;
	}
}
