package pddl.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import pddl.errors.ParsingProblem;
import pddl.formatters.SyntaxTreeFormatter;
import pddl.lexer.PddlToken;
import pddl.lexer.PddlTokenizer;
import pddl.util.DocumentPositionResolver;
import pddl.util.PddlPosition;
import pddl.util.SimpleDocumentPositionResolver;

/**
 * Builds a syntax tree from PDDL tokens, nesting nodes by brackets.
 *
 * Malformed bracket nesting does not stop the build: a close bracket with no
 * open bracket to match stays in the tree as a leaf, and brackets still open
 * at the end of the text keep the span of what they enclose. Both are
 * reported as parsing problems.
 */
public class PddlSyntaxTreeBuilder {

	public static final String UNMATCHED_CLOSE_BRACKET = "Unmatched close bracket";
	public static final String UNMATCHED_OPEN_BRACKET = "Unmatched open bracket";

	private static final PddlTokenizer TOKENIZER = new PddlTokenizer();

	private final PddlSyntaxTree tree;
	private final List<PddlToken> offendingTokens = new ArrayList<>();
	private final List<ParsingProblem> parsingProblems = new ArrayList<>();

	public PddlSyntaxTreeBuilder(String pddlText) {
		this(pddlText, new SimpleDocumentPositionResolver(pddlText));
	}

	public PddlSyntaxTreeBuilder(String pddlText, DocumentPositionResolver positionResolver) {
		PddlSyntaxNode root = PddlSyntaxNode.createRoot();
		this.tree = new PddlSyntaxTree(root);

		Deque<PddlSyntaxNode> openNodes = new ArrayDeque<>();
		openNodes.push(root);

		for (PddlToken token : TOKENIZER.readTokens(pddlText)) {
			PddlSyntaxNode current = openNodes.peek();
			switch (token.getType()) {
				case OPEN_BRACKET:
				case OPEN_BRACKET_OPERATOR:
					PddlBracketNode bracket = new PddlBracketNode(token, current);
					current.addChild(bracket);
					openNodes.push(bracket);
					break;
				case CLOSE_BRACKET:
					if (current.isRoot()) {
						current.addChild(new PddlSyntaxNode(token, current));
						addProblem(UNMATCHED_CLOSE_BRACKET, token, positionResolver);
					} else {
						((PddlBracketNode) current).setCloseBracket(token);
						openNodes.pop();
					}
					break;
				default:
					current.addChild(new PddlSyntaxNode(token, current));
					break;
			}
		}

		// report the outermost unclosed bracket first
		Iterator<PddlSyntaxNode> unclosed = openNodes.descendingIterator();
		while (unclosed.hasNext()) {
			PddlSyntaxNode node = unclosed.next();
			if (!node.isRoot()) {
				addProblem(UNMATCHED_OPEN_BRACKET, node.getToken(), positionResolver);
			}
		}
	}

	private void addProblem(String message, PddlToken token, DocumentPositionResolver positionResolver) {
		offendingTokens.add(token);
		PddlPosition position = positionResolver.resolveToPosition(token.getStart());
		parsingProblems.add(new ParsingProblem(message, position.getLine(), position.getCharacter()));
	}

	public PddlSyntaxTree getTree() {
		return tree;
	}

	public List<PddlToken> getOffendingTokens() {
		return Collections.unmodifiableList(offendingTokens);
	}

	public List<ParsingProblem> getParsingProblems() {
		return Collections.unmodifiableList(parsingProblems);
	}

	public String getTreeAsString() {
		return SyntaxTreeFormatter.format(tree.getRootNode());
	}
}
