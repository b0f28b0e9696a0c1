package pddl.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import pddl.model.ObjectInstance;
import pddl.model.Parameter;
import pddl.model.Term;
import pddl.model.effects.Assign;
import pddl.model.effects.Decrease;
import pddl.model.effects.Effect;
import pddl.model.effects.Increase;
import pddl.model.effects.MakeFalse;
import pddl.model.effects.MakeTrue;
import pddl.model.effects.ScaleDown;
import pddl.model.effects.ScaleUp;
import pddl.model.effects.UnrecognizedEffect;

public class ActionEffectParserTest {

	private static PddlSyntaxNode singleNode(String pddlText) {
		return new PddlSyntaxTreeBuilder(pddlText).getTree().getRootNode().getSingleChild();
	}

	@Test
	public void proposition() {
		PddlSyntaxNode node = singleNode("(p)");
		Effect actual = ActionEffectParser.parseEffect(node);

		assertThat(actual, instanceOf(MakeTrue.class));
		assertThat(actual.getNode(), is(node));
		assertThat(((MakeTrue) actual).getVariableModified().getFullName(), is("p"));
	}

	@Test
	public void negation() {
		PddlSyntaxNode node = singleNode("(not (p))");
		Effect actual = ActionEffectParser.parseEffect(node);

		assertThat(actual, instanceOf(MakeFalse.class));
		assertThat(actual.getNode(), is(node));
		assertThat(((MakeFalse) actual).getVariableModified().getFullName(), is("p"));
		assertThat(actual.toPddlString(), is("(not (p))"));
	}

	@Test
	public void conjunction() {
		PddlSyntaxNode node = singleNode("(and (p))");
		Effect actual = ActionEffectParser.parseEffect(node);

		assertThat(actual, instanceOf(MakeTrue.class));
		assertThat(actual.getNode(), is(node.getSingleNonWhitespaceChild()));
	}

	@Test
	public void atStartProposition() {
		PddlSyntaxNode node = singleNode("(at start (p))");
		Effect actual = ActionEffectParser.parseEffect(node);

		assertThat(actual, instanceOf(MakeTrue.class));
		assertThat(actual.getNode(), is(node.getSingleNonWhitespaceChild()));
	}

	@Test
	public void atStartIncrease() {
		String pddlText = "(at start (increase (f) 3))";
		PddlSyntaxTree tree = new PddlSyntaxTreeBuilder(pddlText).getTree();
		PddlSyntaxNode increaseNode = tree.getRootNode().getSingleChild().getSingleNonWhitespaceChild();
		PddlSyntaxNode expressionNode = tree.getNodeAt(pddlText.indexOf("3") + 1);

		Effect actual = ActionEffectParser.parseEffect(increaseNode);

		assertThat(actual, instanceOf(Increase.class));
		Increase increase = (Increase) actual;
		assertThat(increase.getNode(), is(increaseNode));
		assertThat(increase.getVariableModified().getFullName(), is("f"));
		assertThat(increase.getExpressionNode(), is(expressionNode));
		assertThat(increase.getExpressionText(), is("3"));
	}

	@Test
	public void numericEffects() {
		assertThat(ActionEffectParser.parseEffect(singleNode("(assign (f) 1)")), instanceOf(Assign.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(decrease (f) (g))")), instanceOf(Decrease.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(scale-up (f) 2)")), instanceOf(ScaleUp.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(scale-down (f) 2)")), instanceOf(ScaleDown.class));
	}

	@Test
	public void arguments() {
		MakeTrue actual = (MakeTrue) ActionEffectParser.parseEffect(singleNode("(at ?t depot1)"));

		assertThat(actual.getVariableModified().getName(), is("at"));
		assertThat(actual.getVariableModified().getParameters().get(0), is((Term) new Parameter("t", "object")));
		assertThat(actual.getVariableModified().getParameters().get(1), is((Term) new ObjectInstance("depot1", "object")));
		assertFalse(actual.getVariableModified().isGrounded());
	}

	@Test
	public void unrecognized() {
		assertThat(ActionEffectParser.parseEffect(singleNode("(and (p) (q))")), instanceOf(UnrecognizedEffect.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(not (p) (q))")), instanceOf(UnrecognizedEffect.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(increase (f))")), instanceOf(UnrecognizedEffect.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("(when (p) (q))")), instanceOf(UnrecognizedEffect.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("()")), instanceOf(UnrecognizedEffect.class));
		assertThat(ActionEffectParser.parseEffect(singleNode("p")), instanceOf(UnrecognizedEffect.class));
	}
}
