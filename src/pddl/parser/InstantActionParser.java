package pddl.parser;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import pddl.lexer.PddlTokenType;
import pddl.model.Event;
import pddl.model.InstantAction;
import pddl.model.Parameter;
import pddl.model.PreconditionEffectConstruct;
import pddl.model.Process;
import pddl.util.DocumentPositionResolver;

/**
 * Parses `(:action ...)`, `(:process ...)` and `(:event ...)` blocks:
 * <pre>
 * (:action name
 *     :parameters (&lt;parameters&gt;)
 *     :precondition (and &lt;conditions&gt;)
 *     :effect (and &lt;effects&gt;)
 * )
 * </pre>
 * Fields are looked up by keyword; any of them may be missing.
 */
public class InstantActionParser {

	static final Pattern NAME = Pattern.compile("^[\\w-]+$");

	private InstantActionParser() {}

	public static PreconditionEffectConstruct parse(PddlBracketNode actionNode, DocumentPositionResolver positionResolver) {
		String name = parseName(actionNode).orElse(null);
		List<Parameter> parameters = parseParameters(actionNode);
		PddlBracketNode precondition = actionNode.getKeywordOpenBracket("precondition").orElse(null);
		PddlBracketNode effect = actionNode.getKeywordOpenBracket("effect").orElse(null);

		PreconditionEffectConstruct construct;
		switch (actionNode.getOperator()) {
			case ":process":
				construct = new Process(name, parameters, actionNode, precondition, effect);
				break;
			case ":event":
				construct = new Event(name, parameters, actionNode, precondition, effect);
				break;
			default:
				construct = new InstantAction(name, parameters, actionNode, precondition, effect);
				break;
		}
		construct.setLocation(positionResolver.resolveToRange(actionNode));
		construct.setDocumentation(DerivedVariablesParser.getDocumentationAbove(actionNode));
		return construct;
	}

	static Optional<String> parseName(PddlBracketNode actionNode) {
		return actionNode.getFirstChild(PddlTokenType.OTHER, NAME)
				.map(nameNode -> nameNode.getToken().getText());
	}

	static List<Parameter> parseParameters(PddlBracketNode actionNode) {
		return actionNode.getKeywordOpenBracket("parameters")
				.map(parametersNode -> VariablesParser.parseParameters(parametersNode.getNestedNonCommentText()))
				.orElse(Collections.emptyList());
	}
}
