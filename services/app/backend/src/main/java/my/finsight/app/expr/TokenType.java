package my.finsight.app.expr;

public enum TokenType {
	NUMBER,
	IDENTIFIER,
	PLUS,
	MINUS,
	STAR,
	DOUBLE_STAR,
	SLASH,
	PERCENT,
	LPAREN,
	RPAREN,
	SEMICOLON,
	COMMA,
	EOF
}
