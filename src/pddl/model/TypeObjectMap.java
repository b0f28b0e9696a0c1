package pddl.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Objects grouped by type. Type and object lookups ignore case.
 */
public class TypeObjectMap {

	private final Map<String, TypeObjects> typeNameToTypeObjects = new LinkedHashMap<>();
	private final Map<String, TypeObjects> objectNameToTypeObjects = new LinkedHashMap<>();

	public int size() {
		return typeNameToTypeObjects.size();
	}

	public TypeObjectMap add(String type, String objectName) {
		TypeObjects typeObjects = upsert(type);
		typeObjects.addObject(objectName);
		objectNameToTypeObjects.put(objectName.toLowerCase(Locale.ROOT), typeObjects);
		return this;
	}

	public TypeObjectMap addAll(String type, Collection<String> objectNames) {
		TypeObjects typeObjects = upsert(type);
		typeObjects.addAllObjects(objectNames);
		for (String objectName : objectNames) {
			objectNameToTypeObjects.put(objectName.toLowerCase(Locale.ROOT), typeObjects);
		}
		return this;
	}

	/**
	 * Adds all objects of the other map to this one.
	 */
	public TypeObjectMap merge(TypeObjectMap other) {
		for (TypeObjects typeObjects : other.getTypeObjects()) {
			addAll(typeObjects.getType(), typeObjects.getObjects());
		}
		return this;
	}

	private TypeObjects upsert(String type) {
		return typeNameToTypeObjects.computeIfAbsent(type.toLowerCase(Locale.ROOT), t -> new TypeObjects(type));
	}

	public Optional<TypeObjects> getTypeCaseInsensitive(String type) {
		return Optional.ofNullable(typeNameToTypeObjects.get(type.toLowerCase(Locale.ROOT)));
	}

	/**
	 * @return the group the object belongs to
	 */
	public Optional<TypeObjects> getTypeOf(String objectName) {
		return Optional.ofNullable(objectNameToTypeObjects.get(objectName.toLowerCase(Locale.ROOT)));
	}

	public List<TypeObjects> getTypeObjects() {
		return new ArrayList<>(typeNameToTypeObjects.values());
	}

	public static TypeObjectMap of(List<TypeObjects> typeObjects) {
		TypeObjectMap map = new TypeObjectMap();
		for (TypeObjects group : typeObjects) {
			map.addAll(group.getType(), group.getObjects());
		}
		return map;
	}
}
