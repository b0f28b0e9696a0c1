package pddl.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import pddl.lexer.PddlToken;
import pddl.lexer.PddlTokenType;

/**
 * Tree node for an open/close bracket pair. The close bracket is not a child;
 * a bracket that was never closed ends where its last child ends.
 */
public class PddlBracketNode extends PddlSyntaxNode {

	private PddlToken closeToken;

	PddlBracketNode(PddlToken token, PddlSyntaxNode parent) {
		super(token, parent);
	}

	void setCloseBracket(PddlToken token) {
		this.closeToken = token;
	}

	public Optional<PddlToken> getCloseBracket() {
		return Optional.ofNullable(closeToken);
	}

	public boolean isClosed() {
		return closeToken != null;
	}

	/**
	 * @return the operator fused with the open bracket, lower case with single spaces,
	 * e.g. `:action`, `increase` or `at start`; empty for a plain bracket
	 */
	public String getOperator() {
		return normalize(getToken().getText().substring(1));
	}

	public boolean isOperator(String... operators) {
		String operator = getOperator();
		return !operator.isEmpty() && Arrays.stream(operators).anyMatch(operator::equalsIgnoreCase);
	}

	public boolean isOperator(List<String> operators) {
		return isOperator(operators.toArray(new String[0]));
	}

	/**
	 * @return the operator, or for a plain bracket the first name inside it, e.g. `at` for `(at ?x)`;
	 * empty if the bracket starts with something else
	 */
	public String getHeadSymbol() {
		if (isType(PddlTokenType.OPEN_BRACKET_OPERATOR)) {
			return getOperator();
		}
		List<PddlSyntaxNode> children = getNonWhitespaceNonCommentChildren();
		if (!children.isEmpty() && children.get(0).isType(PddlTokenType.OTHER)) {
			return children.get(0).getToken().getText();
		}
		return "";
	}

	/**
	 * @return the text between the brackets, e.g. `at ?l - location` for `(at ?l - location)`
	 */
	public String getContentText() {
		return getToken().getText().substring(1) + getNestedText();
	}

	public String getNonCommentContentText() {
		return getToken().getText().substring(1) + getNestedNonCommentText();
	}

	/**
	 * @return true if there is no nested bracket
	 */
	public boolean isLeafBracket() {
		return getChildren().stream().noneMatch(PddlSyntaxNode::isOpenBracket);
	}

	@Override
	public String getText() {
		return super.getText() + (closeToken != null ? closeToken.getText() : "");
	}

	@Override
	public String getNonCommentText() {
		return super.getNonCommentText() + (closeToken != null ? closeToken.getText() : "");
	}

	@Override
	public int getEnd() {
		if (closeToken != null) {
			return closeToken.getEnd();
		}
		return super.getEnd();
	}

	static String normalize(String text) {
		return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
	}
}
