package pddl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pddl.lexer.PddlTokenType;
import pddl.model.FileInfo;
import pddl.model.FileStatus;
import pddl.model.Metric;
import pddl.model.ProblemInfo;
import pddl.model.SupplyDemand;
import pddl.model.TimedVariableValue;
import pddl.model.UnsupportedVariableValue;
import pddl.model.VariableValue;
import pddl.util.DocumentPositionResolver;

/**
 * Planning problem parser.
 */
public class PddlProblemParser {

	private static final Pattern PROBLEM_HEADER = Pattern.compile(
			"^\\s*\\(define\\s*\\(problem\\s+([^\\s()]+)\\s*\\)\\s*\\(:domain\\s+([^\\s()]+)\\s*\\)", Pattern.CASE_INSENSITIVE);
	private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

	/**
	 * @return the problem, or nothing if the text does not start with the
	 * `(define (problem name) (:domain name)` header
	 */
	public Optional<ProblemInfo> tryParse(String fileUri, int fileVersion, String fileText, PddlSyntaxTree syntaxTree,
			DocumentPositionResolver positionResolver) {
		Matcher matcher = PROBLEM_HEADER.matcher(FileInfo.stripComments(fileText));
		if (!matcher.find()) {
			return Optional.empty();
		}
		ProblemInfo problemInfo = new ProblemInfo(fileUri, fileVersion, matcher.group(1), matcher.group(2),
				syntaxTree, positionResolver);
		problemInfo.setText(fileText);
		syntaxTree.getDefineNode().ifPresent(defineNode -> parseProblemStructure(defineNode, problemInfo));
		problemInfo.setStatus(FileStatus.PARSED);
		return Optional.of(problemInfo);
	}

	private void parseProblemStructure(PddlBracketNode defineNode, ProblemInfo problemInfo) {
		PddlDomainParser.parseRequirements(defineNode, problemInfo);

		defineNode.getFirstOpenBracket(":objects").ifPresent(objectsNode -> problemInfo.setObjects(
				PddlInheritanceParser.toTypeObjects(
						PddlInheritanceParser.parseInheritance(objectsNode.getNestedNonCommentText()))));

		defineNode.getFirstOpenBracket(":init").ifPresent(initNode -> {
			problemInfo.setInits(parseInits(initNode));
			problemInfo.setSupplyDemands(parseSupplyDemands(initNode));
		});

		defineNode.getFirstOpenBracket(":goal").ifPresent(goalNode -> {
			List<PddlSyntaxNode> children = goalNode.getNonWhitespaceNonCommentChildren();
			if (!children.isEmpty()) {
				problemInfo.setGoal(children.get(0));
			}
		});

		defineNode.getFirstOpenBracket(":metric").ifPresent(metricNode -> parseMetric(metricNode)
				.ifPresent(problemInfo::setMetric));

		defineNode.getFirstOpenBracket(":constraints").ifPresent(constraintsNode -> problemInfo.setConstraints(
				new PddlConstraintsParser().parseConstraints(constraintsNode)));
	}

	/**
	 * @return the values of the `:init` section, except supply-demand contracts
	 */
	List<TimedVariableValue> parseInits(PddlBracketNode initNode) {
		List<TimedVariableValue> values = new ArrayList<>();
		for (PddlSyntaxNode child : initNode.getChildren()) {
			if (child.isOpenBracket() && !((PddlBracketNode) child).isOperator("supply-demand")) {
				values.add(parseInit((PddlBracketNode) child));
			}
		}
		return values;
	}

	List<SupplyDemand> parseSupplyDemands(PddlBracketNode initNode) {
		List<SupplyDemand> supplyDemands = new ArrayList<>();
		for (PddlBracketNode bracket : initNode.getOpenBrackets("supply-demand")) {
			List<PddlSyntaxNode> tokens = bracket.getNonWhitespaceNonCommentChildren();
			if (!tokens.isEmpty() && tokens.get(0).isType(PddlTokenType.OTHER)) {
				supplyDemands.add(new SupplyDemand(tokens.get(0).getText()));
			}
		}
		return supplyDemands;
	}

	/**
	 * Parses `(at TIME fact)`, `(= (f a) 1)`, `(not (p a))` or `(p a)`.
	 * Anything else is kept as an unsupported value at time 0.
	 */
	TimedVariableValue parseInit(PddlBracketNode bracket) {
		if (bracket.isOperator("at")) {
			List<PddlSyntaxNode> tokens = bracket.getNonWhitespaceNonCommentChildren();
			if (tokens.size() > 1 && tokens.get(0).isType(PddlTokenType.OTHER)
					&& NUMBER.matcher(tokens.get(0).getText()).matches()) {
				double time = Double.parseDouble(tokens.get(0).getText());
				VariableValue timedValue = parseVariableValue(tokens.get(1));
				if (timedValue != null) {
					return new TimedVariableValue(time, timedValue);
				}
			}
		}
		VariableValue value = parseVariableValue(bracket);
		if (value == null) {
			value = new UnsupportedVariableValue(VariablesParser.collapseWhitespace(bracket.getNonCommentContentText()));
		}
		return new TimedVariableValue(0, value);
	}

	/**
	 * @return the value, or null if the node is not a fact or numeric assignment
	 */
	private VariableValue parseVariableValue(PddlSyntaxNode node) {
		if (!node.isOpenBracket()) {
			return null;
		}
		PddlBracketNode bracket = (PddlBracketNode) node;
		List<PddlSyntaxNode> tokens = bracket.getNonWhitespaceNonCommentChildren();
		if (bracket.isOperator("=")) {
			if (tokens.size() == 2 && tokens.get(0).isOpenBracket() && tokens.get(1).isType(PddlTokenType.OTHER)
					&& NUMBER.matcher(tokens.get(1).getText()).matches()) {
				String variableName = VariablesParser.collapseWhitespace(
						((PddlBracketNode) tokens.get(0)).getNonCommentContentText());
				return new VariableValue(variableName, Double.parseDouble(tokens.get(1).getText()));
			}
			return null;
		} else if (bracket.isOperator("not")) {
			if (tokens.size() != 1) {
				return null;
			}
			VariableValue nested = parseVariableValue(tokens.get(0));
			if (nested == null || nested.isNumeric()) {
				return null;
			}
			return nested.negate();
		} else {
			if (!bracket.isLeafBracket()) {
				return null;
			}
			String variableName = VariablesParser.collapseWhitespace(bracket.getNonCommentContentText());
			if (variableName.isEmpty()) {
				return null;
			}
			return new VariableValue(variableName, true);
		}
	}

	private Optional<Metric> parseMetric(PddlBracketNode metricNode) {
		List<PddlSyntaxNode> children = metricNode.getNonWhitespaceNonCommentChildren();
		if (children.size() < 2) {
			return Optional.empty();
		}
		Metric.Direction direction;
		switch (children.get(0).getText().toLowerCase(Locale.ROOT)) {
			case "minimize":
				direction = Metric.Direction.MINIMIZE;
				break;
			case "maximize":
				direction = Metric.Direction.MAXIMIZE;
				break;
			default:
				direction = Metric.Direction.UNKNOWN;
				break;
		}
		return Optional.of(new Metric(direction, children.get(1)));
	}
}
