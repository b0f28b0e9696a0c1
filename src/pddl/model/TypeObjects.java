package pddl.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Objects (or constants) declared with the same type.
 */
public class TypeObjects {

	private final String type;
	private final Set<String> objects = new LinkedHashSet<>();

	public TypeObjects(String type) {
		this.type = type;
	}

	public String getType() {
		return type;
	}

	public List<String> getObjects() {
		return new ArrayList<>(objects);
	}

	public TypeObjects addObject(String objectName) {
		objects.add(objectName);
		return this;
	}

	public TypeObjects addAllObjects(Collection<String> objectNames) {
		objects.addAll(objectNames);
		return this;
	}

	public boolean hasObject(String objectName) {
		String lowerCase = objectName.toLowerCase(Locale.ROOT);
		return objects.stream().anyMatch(o -> o.toLowerCase(Locale.ROOT).equals(lowerCase));
	}

	public ObjectInstance getObjectInstance(String objectName) {
		return new ObjectInstance(objectName, type);
	}

	@Override
	public String toString() {
		return String.join(" ", objects) + " - " + type;
	}
}
