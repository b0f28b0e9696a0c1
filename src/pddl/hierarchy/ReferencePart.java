package pddl.hierarchy;

import java.util.Locale;

/**
 * Part of a construct where a variable is referenced.
 */
public enum ReferencePart {
	DURATION,
	CONDITION,
	EFFECT,
	NONE;

	/**
	 * @return e.g. `condition`, or an empty string for NONE
	 */
	public String getLabel() {
		return this == NONE ? "" : name().toLowerCase(Locale.ROOT);
	}
}
