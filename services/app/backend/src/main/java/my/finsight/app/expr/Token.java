package my.finsight.app.expr;

public record Token(TokenType type, String text, int position) {
	@Override
	public String toString() {
		return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
	}
}
