package pddl.lexer;

public enum PddlTokenType {
	// open bracket fused with the operator that follows it, e.g. `(:action`, `(increase` or `(at start`
	OPEN_BRACKET_OPERATOR,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	// e.g. `:parameters` or `:effect`
	KEYWORD,
	DASH,
	// e.g. `?p1`
	PARAMETER,
	// vertical or horizontal whitespace; multi-line runs are kept in one token
	WHITESPACE,
	OTHER,
	// anything after `;` up to the end of the line, including the semicolon
	COMMENT,
	// root of the syntax tree, never produced by the tokenizer
	DOCUMENT,
}
