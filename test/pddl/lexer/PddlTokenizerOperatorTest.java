package pddl.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class PddlTokenizerOperatorTest {

	@Test
	public void timeQualifierIsOneToken() {
		List<PddlToken> tokens = new PddlTokenizer().readTokens("(over  all (p))");
		assertThat(tokens.get(0).getType(), is(PddlTokenType.OPEN_BRACKET_OPERATOR));
		assertThat(tokens.get(0).getText(), is("(over  all"));
	}

	@Test
	public void longestOperatorWins() {
		assertThat(new PddlTokenizer().readTokens("(at end").get(0).getText(), is("(at end"));
		assertThat(new PddlTokenizer().readTokens("(at 10 (p))").get(0).getText(), is("(at"));
		assertThat(new PddlTokenizer().readTokens("(<= (f) 1)").get(0).getText(), is("(<="));
		assertThat(new PddlTokenizer().readTokens("(scale-up (f) 2)").get(0).getText(), is("(scale-up"));
	}

	@Test
	public void keywordFusedWithBracket() {
		PddlToken token = new PddlTokenizer().readTokens("(:durative-action move").get(0);
		assertThat(token.getType(), is(PddlTokenType.OPEN_BRACKET_OPERATOR));
		assertThat(token.getText(), is("(:durative-action"));
	}

	@Test
	public void commentExcludesCarriageReturn() {
		List<PddlToken> tokens = new PddlTokenizer().readTokens("; doc\r\n");
		assertThat(tokens.get(0).getText(), is("; doc"));
		assertThat(tokens.get(1).getText(), is("\r\n"));
	}

	@Test
	public void stopsAfterLastIndexOfInterest() {
		List<PddlToken> tokens = new PddlTokenizer().readTokens("(a b c)", 2);
		assertThat(tokens.size(), is(3));
		assertThat(tokens.get(2).getType(), is(PddlTokenType.WHITESPACE));
	}
}
