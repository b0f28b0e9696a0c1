package pddl.parser;

import java.util.ArrayList;
import java.util.List;

import pddl.model.ObjectInstance;
import pddl.model.Parameter;
import pddl.model.Term;
import pddl.model.Variable;
import pddl.model.effects.Assign;
import pddl.model.effects.Decrease;
import pddl.model.effects.Effect;
import pddl.model.effects.Increase;
import pddl.model.effects.MakeFalse;
import pddl.model.effects.MakeTrue;
import pddl.model.effects.ScaleDown;
import pddl.model.effects.ScaleUp;
import pddl.model.effects.UnrecognizedEffect;

/**
 * Interprets one effect bracket. Malformed effects come back as {@link UnrecognizedEffect}.
 */
public class ActionEffectParser {

	private ActionEffectParser() {}

	public static Effect parseEffect(PddlSyntaxNode node) {
		if (!node.isOpenBracket()) {
			return new UnrecognizedEffect(node);
		}
		PddlBracketNode bracket = (PddlBracketNode) node;
		List<PddlSyntaxNode> children = bracket.getNonWhitespaceNonCommentChildren();
		switch (bracket.getOperator()) {
			case "not":
				if (children.size() == 1) {
					return new MakeFalse(bracket, parseVariable(children.get(0)));
				}
				return new UnrecognizedEffect(bracket);
			case "assign":
			case "increase":
			case "decrease":
			case "scale-up":
			case "scale-down":
				if (children.size() == 2) {
					return parseExpressionEffect(bracket, parseVariable(children.get(0)), children.get(1));
				}
				return new UnrecognizedEffect(bracket);
			case "and":
			case "at start":
			case "at end":
				if (children.size() == 1) {
					return parseEffect(children.get(0));
				}
				return new UnrecognizedEffect(bracket);
			default:
				if (bracket.isLeafBracket() && !bracket.getNonCommentContentText().trim().isEmpty()) {
					return new MakeTrue(bracket, parseVariable(bracket));
				}
				return new UnrecognizedEffect(bracket);
		}
	}

	private static Effect parseExpressionEffect(PddlBracketNode node, Variable variable, PddlSyntaxNode expression) {
		switch (node.getOperator()) {
			case "assign":
				return new Assign(node, variable, expression);
			case "increase":
				return new Increase(node, variable, expression);
			case "decrease":
				return new Decrease(node, variable, expression);
			case "scale-up":
				return new ScaleUp(node, variable, expression);
			default:
				return new ScaleDown(node, variable, expression);
		}
	}

	/**
	 * Reads `(name arg1 arg2)`; arguments starting with `?` become parameters, the rest objects.
	 */
	static Variable parseVariable(PddlSyntaxNode node) {
		String text = node.isOpenBracket()
				? ((PddlBracketNode) node).getNonCommentContentText()
				: node.getNonCommentText();
		String[] fragments = text.trim().split("\\s+");
		List<Term> terms = new ArrayList<>();
		for (int i = 1; i < fragments.length; i++) {
			terms.add(parseTerm(fragments[i]));
		}
		return new Variable(fragments[0], terms);
	}

	private static Term parseTerm(String termText) {
		if (termText.startsWith("?")) {
			return new Parameter(termText.substring(1), "object");
		}
		return new ObjectInstance(termText, "object");
	}
}
