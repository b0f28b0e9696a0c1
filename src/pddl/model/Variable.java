package pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import pddl.util.PddlRange;

/**
 * A state variable: a predicate or a numeric function.
 *
 * The declared name is the declaration text without the brackets, e.g.
 * `at ?p - plane ?l - location`; the name is its first word.
 */
public class Variable {

	private static final Pattern TYPE_SUFFIX = Pattern.compile("\\s+-\\s+[\\w-]+");
	private static final Pattern UNIT = Pattern.compile("\\[([^\\]]*)\\]");

	private final String declaredName;
	private final String declaredNameWithoutTypes;
	private final String name;
	private final List<Term> parameters;
	private List<String> documentation = Collections.emptyList();
	private String unit = "";
	private PddlRange location;

	public Variable(String declaredName, List<? extends Term> parameters) {
		this.declaredName = declaredName;
		this.declaredNameWithoutTypes = TYPE_SUFFIX.matcher(declaredName).replaceAll("");
		this.name = declaredName.split(" ", 2)[0];
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
	}

	public Variable(String declaredName) {
		this(declaredName, Collections.emptyList());
	}

	public String getName() {
		return name;
	}

	public String getDeclaredName() {
		return declaredName;
	}

	public String getDeclaredNameWithoutTypes() {
		return declaredNameWithoutTypes;
	}

	public List<Term> getParameters() {
		return parameters;
	}

	/**
	 * @return e.g. `at ?p - plane` for a lifted variable, `at plane1` for a grounded one
	 */
	public String getFullName() {
		StringBuilder fullName = new StringBuilder(name);
		for (Term parameter : parameters) {
			fullName.append(' ').append(parameter.toPddlString());
		}
		return fullName.toString();
	}

	/**
	 * Grounds this variable.
	 *
	 * @param objects one object per parameter, in order
	 * @throws IllegalArgumentException if the number of objects does not match the parameters
	 */
	public Variable bind(List<ObjectInstance> objects) {
		String objectNames = objects.stream().map(ObjectInstance::getName).collect(Collectors.joining(" "));
		if (objects.size() != parameters.size()) {
			throw new IllegalArgumentException("Invalid objects '" + objectNames + "' for function '"
					+ getFullName() + "' with " + parameters.size() + " parameters.");
		}
		String fullName = objects.isEmpty() ? name : name + " " + objectNames;
		return new Variable(fullName, objects);
	}

	public boolean matchesShortNameCaseInsensitive(String symbolName) {
		return name.toLowerCase(Locale.ROOT).equals(symbolName.toLowerCase(Locale.ROOT));
	}

	public boolean isGrounded() {
		return parameters.stream().allMatch(Term::isGrounded);
	}

	/**
	 * Sets the documentation lines; a `[unit]` anywhere in them becomes the unit.
	 */
	public void setDocumentation(List<String> documentation) {
		this.documentation = Collections.unmodifiableList(new ArrayList<>(documentation));
		Matcher matcher = UNIT.matcher(String.join("\n", documentation));
		if (matcher.find()) {
			unit = matcher.group(1);
		}
	}

	public List<String> getDocumentation() {
		return documentation;
	}

	public String getUnit() {
		return unit;
	}

	public void setLocation(PddlRange location) {
		this.location = location;
	}

	public Optional<PddlRange> getLocation() {
		return Optional.ofNullable(location);
	}

	@Override
	public String toString() {
		return getFullName();
	}
}
