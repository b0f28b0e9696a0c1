package pddl.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pddl.model.Parameter;
import pddl.model.Variable;
import pddl.util.PddlRange;
import pddl.util.SimpleDocumentPositionResolver;

public class VariablesParserTest {

	private static List<Variable> parse(String pddlText) {
		PddlSyntaxNode node = new PddlSyntaxTreeBuilder(pddlText).getTree().getRootNode();
		return new VariablesParser(node, new SimpleDocumentPositionResolver(pddlText)).getVariables();
	}

	@Test
	public void onePredicate() {
		String pddlText = "(said_hello)";
		List<Variable> variables = parse(pddlText);

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getFullName(), is("said_hello"));
		assertThat(variables.get(0).getLocation().get(), is(new PddlRange(0, 0, 0, pddlText.length())));
	}

	@Test
	public void atPredicate() {
		List<Variable> variables = parse("(at)");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getFullName(), is("at"));
		assertThat(variables.get(0).getLocation().get(), is(new PddlRange(0, 0, 0, 4)));
	}

	@Test
	public void predicateWithParameter() {
		String pddlText = "(said_hello ?w - world)";
		List<Variable> variables = parse(pddlText);

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getFullName(), is("said_hello ?w - world"));
		assertThat(variables.get(0).getParameters(), is(Collections.singletonList(new Parameter("w", "world"))));
		assertThat(variables.get(0).getDeclaredNameWithoutTypes(), is("said_hello ?w"));
	}

	@Test
	public void commentToTheRight() {
		List<Variable> variables = parse("(said_hello) ; comment [unit]");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getDocumentation(), is(Collections.singletonList("comment [unit]")));
		assertThat(variables.get(0).getUnit(), is("unit"));
		assertThat(variables.get(0).getLocation().get(), is(new PddlRange(0, 0, 0, "(said_hello)".length())));
	}

	@Test
	public void commentOnTop() {
		List<Variable> variables = parse("; comment [unit]\n(said_hello) ");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getFullName(), is("said_hello"));
		assertThat(variables.get(0).getDocumentation(), is(Collections.singletonList("comment [unit]")));
		assertThat(variables.get(0).getUnit(), is("unit"));
		assertThat(variables.get(0).getLocation().get(), is(new PddlRange(1, 0, 1, "(said_hello)".length())));
	}

	@Test
	public void twoCommentsOnTop() {
		List<Variable> variables = parse("; comment1\n" +
				"    ; comment2 [unit]\n" +
				"    (said_hello) ");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getDocumentation(), is(Arrays.asList("comment1", "comment2 [unit]")));
		assertThat(variables.get(0).getUnit(), is("unit"));
	}

	@Test
	public void twoPredicatesWithCommentsOnTop() {
		List<Variable> variables = parse("; comment1 [unit1]\n(said_hello)\n; comment2 [unit2]\n(said_goodbye)");

		assertThat(variables.size(), is(2));
		assertThat(variables.get(0).getFullName(), is("said_hello"));
		assertThat(variables.get(0).getDocumentation(), is(Collections.singletonList("comment1 [unit1]")));
		assertThat(variables.get(0).getUnit(), is("unit1"));
		assertThat(variables.get(1).getFullName(), is("said_goodbye"));
		assertThat(variables.get(1).getDocumentation(), is(Collections.singletonList("comment2 [unit2]")));
		assertThat(variables.get(1).getUnit(), is("unit2"));
		assertThat(variables.get(1).getLocation().get(), is(new PddlRange(3, 0, 3, "(said_goodbye)".length())));
	}

	@Test
	public void twoPredicatesWithCommentsToTheRight() {
		List<Variable> variables = parse("; two predicates\n" +
				"    \n" +
				"    (said_hello) ; comment1 [unit1]\n" +
				"    (said_goodbye) ; comment2 [unit2]");

		assertThat(variables.size(), is(2));
		assertThat(variables.get(0).getDocumentation(), is(Collections.singletonList("comment1 [unit1]")));
		assertThat(variables.get(0).getUnit(), is("unit1"));
		assertThat(variables.get(1).getDocumentation(), is(Collections.singletonList("comment2 [unit2]")));
		assertThat(variables.get(1).getUnit(), is("unit2"));
	}

	@Test
	public void commentsAboveEmptyLineAreIgnored() {
		List<Variable> variables = parse("; general comments\n" +
				"    \n" +
				"    ; comment1\n" +
				"    (said_hello) ");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getDocumentation(), is(Collections.singletonList("comment1")));
	}

	@Test
	public void commentOnTopAndToTheRight() {
		List<Variable> variables = parse("; comment\n" +
				"    (said_hello) ; [unit] ");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getDocumentation(), is(Arrays.asList("comment", "[unit]")));
		assertThat(variables.get(0).getUnit(), is("unit"));
	}

	@Test
	public void declarationsOnOneLineFormOneChunk() {
		List<Variable> variables = parse("(f)(g)");

		assertThat(variables.size(), is(1));
		assertThat(variables.get(0).getName(), is("g"));
	}

	@Test
	public void predicatesSection() {
		String pddlText = "(:predicates\n" +
				"    (at ?t - truck ?l - location) ; truck location\n" +
				"    (road ?from ?to - location)\n" +
				")";
		PddlSyntaxNode predicatesNode = new PddlSyntaxTreeBuilder(pddlText).getTree().getRootNode().getSingleChild();
		List<Variable> variables = new VariablesParser(predicatesNode, new SimpleDocumentPositionResolver(pddlText))
				.getVariables();

		assertThat(variables.size(), is(2));
		Variable at = variables.get(0);
		assertThat(at.getName(), is("at"));
		assertThat(at.getDeclaredName(), is("at ?t - truck ?l - location"));
		assertThat(at.getDocumentation(), is(Collections.singletonList("truck location")));
		assertThat(at.getParameters(), is(Arrays.asList(new Parameter("t", "truck"), new Parameter("l", "location"))));
		Variable road = variables.get(1);
		assertThat(road.getName(), is("road"));
		assertThat(road.getDocumentation(), is(Collections.emptyList()));
		assertThat(road.getParameters().size(), is(2));
		assertThat(road.getLocation().get(), is(new PddlRange(2, 4, 2, 31)));
	}
}
