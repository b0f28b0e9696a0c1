package pddl.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pddl.lexer.PddlTokenType;
import pddl.model.Parameter;
import pddl.model.Variable;
import pddl.util.DocumentPositionResolver;

/**
 * Parses the `:predicates` and `:functions` sections.
 *
 * The children of the section are split into chunks, one per declaration. A
 * line break after a declaration bracket ends its chunk, so a comment on the
 * same line still documents it. An empty line discards whatever was collected
 * since the last declaration. Comments in a chunk become the documentation of
 * the declaration in that chunk.
 */
public class VariablesParser {

	private static final Pattern PARAMETER_GROUP = Pattern.compile("((\\?\\w+\\s+)+)-\\s+(\\w[\\w-]*)");
	private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

	private final DocumentPositionResolver positionResolver;
	private final List<List<PddlSyntaxNode>> chunks = new ArrayList<>();
	private final List<Variable> variables = new ArrayList<>();

	private List<PddlSyntaxNode> currentVariableNodes = new ArrayList<>();
	private boolean variableNodeEncountered = false;
	private int consecutiveVerticalWhitespaceCount = 0;

	public VariablesParser(PddlSyntaxNode predicatesNode, DocumentPositionResolver positionResolver) {
		this.positionResolver = positionResolver;

		chunkByVerticalWhitespace(predicatesNode);

		for (List<PddlSyntaxNode> chunk : chunks) {
			Variable variable = processChunk(chunk);
			if (variable != null) {
				variables.add(variable);
			}
		}
	}

	private void chunkByVerticalWhitespace(PddlSyntaxNode predicatesNode) {
		for (PddlSyntaxNode node : predicatesNode.getChildren()) {
			if (node.isType(PddlTokenType.WHITESPACE)) {
				int verticalWhitespaceCount = countLineBreaks(node.getText());
				// end of line after a declaration ends its chunk
				if (verticalWhitespaceCount > 0 && variableNodeEncountered) {
					addCurrentVariableChunkAndReset();
				}
				consecutiveVerticalWhitespaceCount += verticalWhitespaceCount;
				if (consecutiveVerticalWhitespaceCount >= 2) {
					// empty line
					reset();
				}
			} else {
				consecutiveVerticalWhitespaceCount = 0;
				if (node.isOpenBracket()) {
					variableNodeEncountered = true;
				}
				currentVariableNodes.add(node);
			}
		}
		if (!currentVariableNodes.isEmpty()) {
			addCurrentVariableChunkAndReset();
		}
	}

	private static int countLineBreaks(String text) {
		Matcher matcher = LINE_BREAK.matcher(text);
		int count = 0;
		while (matcher.find()) {
			count++;
		}
		return count;
	}

	private Variable processChunk(List<PddlSyntaxNode> chunk) {
		List<String> documentation = new ArrayList<>();
		PddlBracketNode variableNode = null;

		for (PddlSyntaxNode node : chunk) {
			if (node.isType(PddlTokenType.COMMENT)) {
				String text = node.getText();
				int indexOfSemicolon = text.indexOf(';');
				if (indexOfSemicolon > -1) {
					documentation.add(text.substring(indexOfSemicolon + 1).trim());
				}
			} else if (node.isOpenBracket()) {
				variableNode = (PddlBracketNode) node;
			}
		}

		if (variableNode == null) {
			return null;
		}

		Variable variable = parseDeclaration(variableNode);
		variable.setDocumentation(documentation);
		variable.setLocation(positionResolver.resolveToRange(variableNode));
		return variable;
	}

	private void addCurrentVariableChunkAndReset() {
		chunks.add(currentVariableNodes);
		reset();
	}

	private void reset() {
		currentVariableNodes = new ArrayList<>();
		variableNodeEncountered = false;
		consecutiveVerticalWhitespaceCount = 0;
	}

	public List<Variable> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	/**
	 * @param declarationNode e.g. `(at ?p - plane ?l - location)`
	 */
	static Variable parseDeclaration(PddlBracketNode declarationNode) {
		String fullSymbolName = collapseWhitespace(declarationNode.getNonCommentContentText());
		return new Variable(fullSymbolName, parseParameters(fullSymbolName));
	}

	static String collapseWhitespace(String text) {
		return text.trim().replaceAll("\\s+", " ");
	}

	/**
	 * Parses typed parameters; `?x ?y - block ?z - table` gives x and y of type block and z of type table.
	 * Parameters without a type are not returned.
	 */
	public static List<Parameter> parseParameters(String fullSymbolName) {
		List<Parameter> parameters = new ArrayList<>();
		Matcher matcher = PARAMETER_GROUP.matcher(fullSymbolName);
		while (matcher.find()) {
			String names = matcher.group(1);
			String type = matcher.group(3);
			for (String name : names.trim().split("\\s+")) {
				parameters.add(new Parameter(name.substring(1), type));
			}
		}
		return parameters;
	}
}
