package pddl.parser;

import pddl.model.DurativeAction;
import pddl.util.DocumentPositionResolver;

/**
 * Parses `(:durative-action ...)` blocks:
 * <pre>
 * (:durative-action name
 *     :parameters (&lt;parameters&gt;)
 *     :duration (&lt;duration constraint&gt;)
 *     :condition (and
 *         (at start (&lt;condition&gt;))
 *         (over all (&lt;condition&gt;))
 *         (at end (&lt;condition&gt;))
 *     )
 *     :effect (and
 *         (at start (&lt;effect&gt;))
 *         (at end (&lt;effect&gt;))
 *         (increase (&lt;function&gt;) (* #t &lt;expression&gt;))
 *     )
 * )
 * </pre>
 */
public class DurativeActionParser {

	private DurativeActionParser() {}

	public static DurativeAction parse(PddlBracketNode actionNode, DocumentPositionResolver positionResolver) {
		DurativeAction action = new DurativeAction(
				InstantActionParser.parseName(actionNode).orElse(null),
				InstantActionParser.parseParameters(actionNode),
				actionNode,
				actionNode.getKeywordOpenBracket("duration").orElse(null),
				actionNode.getKeywordOpenBracket("condition").orElse(null),
				actionNode.getKeywordOpenBracket("effect").orElse(null));
		action.setLocation(positionResolver.resolveToRange(actionNode));
		action.setDocumentation(DerivedVariablesParser.getDocumentationAbove(actionNode));
		return action;
	}
}
