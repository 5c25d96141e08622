package my.finsight.app.expr;

import java.util.ArrayList;
import java.util.List;

public class ExpressionTokenizer {
	private final String source;
	private final boolean allowExponent;
	private int index;

	public ExpressionTokenizer(String source, boolean allowExponent) {
		this.source = source == null ? "" : source;
		this.allowExponent = allowExponent;
	}

	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();
		Token token;
		do {
			token = next();
			tokens.add(token);
		} while (token.type() != TokenType.EOF);
		return tokens;
	}

	private Token next() {
		skipWhitespace();
		if (index >= source.length()) {
			return new Token(TokenType.EOF, "", index);
		}
		int start = index;
		char c = source.charAt(index);
		if (isDigit(c) || (c == '.' && index + 1 < source.length() && isDigit(source.charAt(index + 1)))) {
			return readNumber(start);
		}
		if (Character.isLetter(c) || c == '_') {
			while (index < source.length() && (Character.isLetterOrDigit(source.charAt(index)) || source.charAt(index) == '_')) {
				index++;
			}
			return new Token(TokenType.IDENTIFIER, source.substring(start, index), start);
		}
		index++;
		return switch (c) {
			case '+' -> new Token(TokenType.PLUS, "+", start);
			case '-' -> new Token(TokenType.MINUS, "-", start);
			case '*' -> {
				if (index < source.length() && source.charAt(index) == '*') {
					index++;
					yield new Token(TokenType.DOUBLE_STAR, "**", start);
				}
				yield new Token(TokenType.STAR, "*", start);
			}
			case '/' -> new Token(TokenType.SLASH, "/", start);
			case '%' -> new Token(TokenType.PERCENT, "%", start);
			case '(' -> new Token(TokenType.LPAREN, "(", start);
			case ')' -> new Token(TokenType.RPAREN, ")", start);
			case ';' -> new Token(TokenType.SEMICOLON, ";", start);
			case ',' -> new Token(TokenType.COMMA, ",", start);
			default -> throw new ExpressionException("Invalid character '" + c + "' at position " + start, start);
		};
	}

	private Token readNumber(int start) {
		consumeDigits();
		if (index < source.length() && source.charAt(index) == '.') {
			index++;
			consumeDigits();
		}
		if (allowExponent && index < source.length() && (source.charAt(index) == 'e' || source.charAt(index) == 'E')) {
			int mark = index;
			index++;
			if (index < source.length() && (source.charAt(index) == '+' || source.charAt(index) == '-')) {
				index++;
			}
			if (index < source.length() && isDigit(source.charAt(index))) {
				consumeDigits();
			} else {
				index = mark;
			}
		}
		return new Token(TokenType.NUMBER, source.substring(start, index), start);
	}

	private void consumeDigits() {
		while (index < source.length() && isDigit(source.charAt(index))) {
			index++;
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private void skipWhitespace() {
		while (index < source.length() && Character.isWhitespace(source.charAt(index))) {
			index++;
		}
	}
}
