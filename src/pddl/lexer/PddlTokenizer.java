package pddl.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A PDDL tokenizer that never drops input: concatenating the text of the
 * returned tokens in order reproduces the tokenized text exactly.
 *
 * An open bracket that is immediately followed by one of the OPERATORS (or by
 * a `:keyword`) is fused with it into a single OPEN_BRACKET_OPERATOR token, so
 * that `(:action`, `(increase` or `(at start` can be matched directly.
 * Anything the token pattern does not recognize is emitted as OTHER.
 *
 * Instances hold no matching state between calls, so one tokenizer may be
 * shared between threads.
 */
public class PddlTokenizer {

	static final String[] OPERATORS = {
		// document structure
		"define",
		"domain",
		"problem",
		// logical connectives and quantifiers
		"and",
		"or",
		"not",
		"imply",
		"forall",
		"exists",
		"when",
		"preference",
		// time qualifiers
		"at start",
		"at end",
		"over all",
		"at",
		// numeric comparison and arithmetic
		"=",
		"<",
		">",
		"<=",
		">=",
		"-",
		"/",
		"+",
		"*",
		// numeric effects
		"assign",
		"increase",
		"decrease",
		"scale-up",
		"scale-down",
		// trajectory constraints
		"always",
		"sometime",
		"within",
		"at-most-once",
		"sometime-after",
		"sometime-before",
		"always-within",
		"hold-during",
		"hold-after",
		"supply-demand",
	};

	static final Pattern TOKEN = Pattern.compile(
			"(?<open>\\((?:(?::\\w[\\w-]*|" + operatorAlternation() + ")(?![\\w-]))?)" +
					"|(?<close>\\))" +
					"|(?<comment>;)" +
					"|(?<keyword>:[\\w-]+)" +
					"|(?<parameter>\\?\\w[\\w-]*)" +
					"|(?<number>[-+]?[0-9]*\\.?[0-9]+)" +
					"|(?<dash>-)" +
					"|(?<other>#t|\\w[\\w-]*)" +
					"|(?<whitespace>\\s+)",
			Pattern.CASE_INSENSITIVE);

	private static String operatorAlternation() {
		// longest first, so that e.g. `at start` wins over `at` and `>=` over `>`
		return Arrays.stream(OPERATORS)
				.sorted(Comparator.comparingInt(String::length).reversed())
				.map(op -> Arrays.stream(op.split(" "))
						.map(Pattern::quote)
						.collect(Collectors.joining("\\s+")))
				.collect(Collectors.joining("|"));
	}

	public List<PddlToken> readTokens(CharSequence text) {
		return readTokens(text, Integer.MAX_VALUE);
	}

	/**
	 * Tokenizes text up to (and including) the token that reaches past lastIndexOfInterest.
	 *
	 * @param text the PDDL document text
	 * @param lastIndexOfInterest last offset the caller cares about
	 * @return tokens in document order
	 */
	public List<PddlToken> readTokens(CharSequence text, int lastIndexOfInterest) {
		List<PddlToken> tokens = new ArrayList<>();
		Matcher matcher = TOKEN.matcher(text);
		int position = 0;

		while (position < text.length() && matcher.find(position)) {
			if (matcher.start() > position) {
				tokens.add(new PddlToken(PddlTokenType.OTHER, text.subSequence(position, matcher.start()).toString(), position));
			}

			int end = matcher.end();
			String matched = matcher.group();
			if (matcher.group("open") != null) {
				PddlTokenType type = matched.length() > 1 ? PddlTokenType.OPEN_BRACKET_OPERATOR : PddlTokenType.OPEN_BRACKET;
				tokens.add(new PddlToken(type, matched, matcher.start()));
			} else if (matcher.group("close") != null) {
				tokens.add(new PddlToken(PddlTokenType.CLOSE_BRACKET, matched, matcher.start()));
			} else if (matcher.group("comment") != null) {
				end = endOfLine(text, matcher.start());
				tokens.add(new PddlToken(PddlTokenType.COMMENT, text.subSequence(matcher.start(), end).toString(), matcher.start()));
			} else if (matcher.group("keyword") != null) {
				tokens.add(new PddlToken(PddlTokenType.KEYWORD, matched, matcher.start()));
			} else if (matcher.group("parameter") != null) {
				tokens.add(new PddlToken(PddlTokenType.PARAMETER, matched, matcher.start()));
			} else if (matcher.group("dash") != null) {
				tokens.add(new PddlToken(PddlTokenType.DASH, matched, matcher.start()));
			} else if (matcher.group("whitespace") != null) {
				tokens.add(new PddlToken(PddlTokenType.WHITESPACE, matched, matcher.start()));
			} else {
				// numbers, names and `#t`
				tokens.add(new PddlToken(PddlTokenType.OTHER, matched, matcher.start()));
			}
			position = end;

			if (position > lastIndexOfInterest) {
				return tokens;
			}
		}

		if (position < text.length()) {
			tokens.add(new PddlToken(PddlTokenType.OTHER, text.subSequence(position, text.length()).toString(), position));
		}
		return tokens;
	}

	// the comment excludes the line separator, be it \n or \r\n
	private static int endOfLine(CharSequence text, int commentStart) {
		int end = commentStart;
		while (end < text.length() && text.charAt(end) != '\n') {
			end++;
		}
		if (end < text.length() && end > commentStart && text.charAt(end - 1) == '\r') {
			end--;
		}
		return end;
	}

}
