package pddl.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import pddl.lexer.PddlToken;
import pddl.lexer.PddlTokenType;
import pddl.util.TextRange;

/**
 * Single node in the syntax tree that wraps one tokenizer token.
 *
 * Children are kept in document order. The parent link is only used to search
 * upwards; the tree is owned by its root and never mutated once built.
 */
public class PddlSyntaxNode extends TextRange {

	private static final Pattern PARAMETRISABLE_SCOPE = Pattern.compile(
			"^\\(\\s*(:action|:durative-action|:process|:event|:derived|forall|sumall|exists)$", Pattern.CASE_INSENSITIVE);
	private static final Pattern STRUCTURE_WITH_PARAMETERS_KEYWORD = Pattern.compile(
			":action|:durative-action|:process|:event", Pattern.CASE_INSENSITIVE);

	private final PddlToken token;
	private final PddlSyntaxNode parent;
	private final List<PddlSyntaxNode> children = new ArrayList<>();

	PddlSyntaxNode(PddlToken token, PddlSyntaxNode parent) {
		this.token = token;
		this.parent = parent;
	}

	static PddlSyntaxNode createRoot() {
		return new PddlSyntaxNode(PddlToken.document(), null);
	}

	void addChild(PddlSyntaxNode child) {
		children.add(child);
	}

	public boolean isRoot() {
		return parent == null;
	}

	/**
	 * @return the parent node, or null for the root
	 */
	public PddlSyntaxNode getParent() {
		return parent;
	}

	public PddlToken getToken() {
		return token;
	}

	public List<PddlSyntaxNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public boolean hasChildren() {
		return !children.isEmpty();
	}

	public List<PddlSyntaxNode> getNonWhitespaceChildren() {
		return children.stream()
				.filter(c -> c.isNotType(PddlTokenType.WHITESPACE))
				.collect(Collectors.toList());
	}

	public List<PddlSyntaxNode> getNonWhitespaceNonCommentChildren() {
		return children.stream()
				.filter(c -> c.isNotType(PddlTokenType.WHITESPACE) && c.isNotType(PddlTokenType.COMMENT))
				.collect(Collectors.toList());
	}

	public PddlSyntaxNode getSingleChild() {
		if (children.size() != 1) {
			throw new IllegalStateException("Failed assertion that node '" + getText() + "' has a single child.");
		}
		return children.get(0);
	}

	public PddlSyntaxNode getSingleNonWhitespaceChild() {
		List<PddlSyntaxNode> nonWhitespaceChildren = getNonWhitespaceChildren();
		if (nonWhitespaceChildren.size() != 1) {
			throw new IllegalStateException("Failed assertion that node '" + this + "' has a single non-whitespace child.");
		}
		return nonWhitespaceChildren.get(0);
	}

	public Optional<PddlSyntaxNode> getFirstChild(PddlTokenType type, Pattern pattern) {
		return children.stream()
				.filter(c -> c.isType(type))
				.filter(c -> pattern.matcher(c.getToken().getText()).find())
				.findFirst();
	}

	/**
	 * @param operator e.g. `:predicates` or `domain`
	 * @return the first child bracket opened with the given operator
	 */
	public Optional<PddlBracketNode> getFirstOpenBracket(String operator) {
		return getOpenBrackets(operator).stream().findFirst();
	}

	public List<PddlBracketNode> getOpenBrackets(String operator) {
		List<PddlBracketNode> brackets = new ArrayList<>();
		for (PddlSyntaxNode child : children) {
			if (child.isType(PddlTokenType.OPEN_BRACKET_OPERATOR) && ((PddlBracketNode) child).isOperator(operator)) {
				brackets.add((PddlBracketNode) child);
			}
		}
		return brackets;
	}

	/**
	 * Finds the bracket that follows the `:keyword` among this node's children.
	 * Whitespace and comments between the keyword and the bracket are skipped;
	 * anything else in between means the keyword has no bracket.
	 *
	 * @param keyword keyword name without the colon, e.g. `precondition` to match `:precondition (*)`
	 */
	public Optional<PddlBracketNode> getKeywordOpenBracket(String keyword) {
		String expected = ":" + keyword;
		int index = 0;
		while (index < children.size()) {
			PddlSyntaxNode child = children.get(index++);
			if (child.isType(PddlTokenType.KEYWORD) && child.getToken().getText().equalsIgnoreCase(expected)) {
				break;
			}
		}
		while (index < children.size()) {
			PddlSyntaxNode sibling = children.get(index++);
			if (sibling.isType(PddlTokenType.WHITESPACE) || sibling.isType(PddlTokenType.COMMENT)) {
				continue;
			}
			if (sibling.isOpenBracket()) {
				return Optional.of((PddlBracketNode) sibling);
			}
			return Optional.empty();
		}
		return Optional.empty();
	}

	/**
	 * Visits all descendants depth first, in document order.
	 */
	public void getChildrenRecursively(Predicate<PddlSyntaxNode> test, Consumer<PddlSyntaxNode> callback) {
		for (PddlSyntaxNode child : children) {
			if (test.test(child)) {
				callback.accept(child);
			}
			child.getChildrenRecursively(test, callback);
		}
	}

	public String getText() {
		return token.getText() + getNestedText();
	}

	public String getNestedText() {
		StringBuilder nestedText = new StringBuilder();
		for (PddlSyntaxNode child : children) {
			nestedText.append(child.getText());
		}
		return nestedText.toString();
	}

	public String getNonCommentText() {
		if (isType(PddlTokenType.COMMENT)) {
			return "";
		}
		return token.getText() + getNestedNonCommentText();
	}

	public String getNestedNonCommentText() {
		StringBuilder nestedText = new StringBuilder();
		for (PddlSyntaxNode child : children) {
			nestedText.append(child.getNonCommentText());
		}
		return nestedText.toString();
	}

	@Override
	public int getStart() {
		return token.getStart();
	}

	@Override
	public int getEnd() {
		if (children.isEmpty()) {
			return token.getEnd();
		}
		return Math.max(token.getEnd(), children.get(children.size() - 1).getEnd());
	}

	/**
	 * @return the nearest ancestor (excluding the document root) of the given type whose token text matches
	 */
	public Optional<PddlSyntaxNode> findAncestor(PddlTokenType type, Pattern pattern) {
		PddlSyntaxNode ancestor = parent;
		while (ancestor != null && !ancestor.isDocument()) {
			if (ancestor.isType(type) && pattern.matcher(ancestor.getToken().getText()).find()) {
				return Optional.of(ancestor);
			}
			ancestor = ancestor.parent;
		}
		return Optional.empty();
	}

	/**
	 * @return this node if it is a bracket, otherwise the nearest enclosing bracket
	 */
	public Optional<PddlBracketNode> expand() {
		PddlSyntaxNode node = this;
		while (node != null && !node.isOpenBracket()) {
			node = node.parent;
		}
		return Optional.ofNullable((PddlBracketNode) node);
	}

	/**
	 * Finds the nearest enclosing action, derived predicate or quantifier that declares parameterName.
	 *
	 * @param parameterName parameter name without the `?` sign
	 */
	public Optional<PddlSyntaxNode> findParametrisableScope(String parameterName) {
		PddlSyntaxNode node = this;
		while (node != null && !node.isDocument()) {
			Optional<PddlSyntaxNode> scope = node.findAncestor(PddlTokenType.OPEN_BRACKET_OPERATOR, PARAMETRISABLE_SCOPE);
			if (!scope.isPresent()) {
				return Optional.empty();
			}
			if (scope.get().declaresParameter(parameterName)) {
				return scope;
			}
			node = scope.get();
		}
		return Optional.empty();
	}

	public Optional<PddlSyntaxNode> getParameterDefinition() {
		if (STRUCTURE_WITH_PARAMETERS_KEYWORD.matcher(token.getText()).find()) {
			return getKeywordOpenBracket("parameters").map(bracket -> bracket);
		}
		// quantifiers and derived predicates declare their parameters in the first nested bracket
		List<PddlSyntaxNode> nonWhitespaceChildren = getNonWhitespaceNonCommentChildren();
		if (nonWhitespaceChildren.isEmpty() || !nonWhitespaceChildren.get(0).isOpenBracket()) {
			return Optional.empty();
		}
		return Optional.of(nonWhitespaceChildren.get(0));
	}

	/**
	 * @param parameterName parameter name without the `?` sign
	 */
	public boolean declaresParameter(String parameterName) {
		Pattern pattern = Pattern.compile("\\?" + Pattern.quote(parameterName) + "(?![\\w-])", Pattern.CASE_INSENSITIVE);
		return getParameterDefinition()
				.map(definition -> pattern.matcher(definition.getText()).find())
				.orElse(false);
	}

	public boolean isDocument() {
		return isType(PddlTokenType.DOCUMENT);
	}

	public boolean isOpenBracket() {
		return token.isOpenBracket();
	}

	public boolean isType(PddlTokenType type) {
		return token.getType() == type;
	}

	public boolean isNotType(PddlTokenType type) {
		return token.getType() != type;
	}

	@Override
	public String toString() {
		return token.getType() + ": text: '" + token.getText().replaceAll("\\r?\\n", "\\\\n") + "', range: " + getStart() + "~" + getEnd();
	}
}
