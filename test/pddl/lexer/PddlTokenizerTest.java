package pddl.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import static pddl.lexer.PddlTokenType.*;

@RunWith(Parameterized.class)
public class PddlTokenizerTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"", Arrays.asList()},
				{" \t", Arrays.asList(WHITESPACE)},
				{"; comment", Arrays.asList(COMMENT)},
				{";X\r\n", Arrays.asList(COMMENT, WHITESPACE)},
				{"(define (domain d))", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET_OPERATOR, WHITESPACE, OTHER,
						CLOSE_BRACKET, CLOSE_BRACKET)},
				{"(p ?x)", Arrays.asList(OPEN_BRACKET, OTHER, WHITESPACE, PARAMETER, CLOSE_BRACKET)},
				{"(:requirements :typing)", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, KEYWORD, CLOSE_BRACKET)},
				{"(at start (p))", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET, OTHER, CLOSE_BRACKET, CLOSE_BRACKET)},
				{"(AND (Not (p)))", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET, OTHER,
						CLOSE_BRACKET, CLOSE_BRACKET, CLOSE_BRACKET)},
				{"(at-robby ?r)", Arrays.asList(OPEN_BRACKET, OTHER, WHITESPACE, PARAMETER, CLOSE_BRACKET)},
				{"?a ?b - block", Arrays.asList(PARAMETER, WHITESPACE, PARAMETER, WHITESPACE, DASH, WHITESPACE, OTHER)},
				{"(>= (f) -1.5)", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET, OTHER, CLOSE_BRACKET, WHITESPACE, OTHER,
						CLOSE_BRACKET)},
				{"(* #t 2)", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OTHER, WHITESPACE, OTHER, CLOSE_BRACKET)},
				{"(p) ; c\n(q)", Arrays.asList(
						OPEN_BRACKET, OTHER, CLOSE_BRACKET, WHITESPACE, COMMENT, WHITESPACE, OPEN_BRACKET, OTHER,
						CLOSE_BRACKET)},
				{"@", Arrays.asList(OTHER)},
				{"(a))) (b (", Arrays.asList(
						OPEN_BRACKET, OTHER, CLOSE_BRACKET, CLOSE_BRACKET, CLOSE_BRACKET, WHITESPACE, OPEN_BRACKET, OTHER,
						WHITESPACE, OPEN_BRACKET)},
				{"(at\n end (p))", Arrays.asList(
						OPEN_BRACKET_OPERATOR, WHITESPACE, OPEN_BRACKET, OTHER, CLOSE_BRACKET, CLOSE_BRACKET)},
		});
	}

	private final String pddlText;
	private final List<PddlTokenType> expectedTypes;

	public PddlTokenizerTest(String pddlText, List<PddlTokenType> expectedTypes) {
		this.pddlText = pddlText;
		this.expectedTypes = expectedTypes;
	}

	@Test
	public void tokenTypes() {
		List<PddlToken> tokens = new PddlTokenizer().readTokens(pddlText);
		assertThat(tokens.stream().map(PddlToken::getType).collect(Collectors.toList()), is(expectedTypes));
	}

	@Test
	public void tokensReproduceText() {
		List<PddlToken> tokens = new PddlTokenizer().readTokens(pddlText);
		assertThat(tokens.stream().map(PddlToken::getText).collect(Collectors.joining()), is(pddlText));
		int expectedStart = 0;
		for (PddlToken token : tokens) {
			assertThat(token.getStart(), is(expectedStart));
			expectedStart = token.getEnd();
		}
	}
}
