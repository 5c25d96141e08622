package my.finsight.app.expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing an {@link Expression} tree. Nothing outside the
 * grammar of the selected {@link ExpressionDialect} is accepted.
 */
public class ExpressionParser {
	public static final String SUM_FUNCTION = "SUM";
	public static final int MAX_NESTING = 200;

	private final ExpressionDialect dialect;
	private List<Token> tokens;
	private int cursor;
	private int depth;

	public ExpressionParser(ExpressionDialect dialect) {
		this.dialect = dialect;
	}

	public static Expression parseRowFormula(String text) {
		return new ExpressionParser(ExpressionDialect.ROW_FORMULA).parse(text);
	}

	public static Expression parseMeasureFormula(String text) {
		return new ExpressionParser(ExpressionDialect.MEASURE).parse(text);
	}

	public Expression parse(String text) {
		tokens = new ExpressionTokenizer(text, dialect == ExpressionDialect.MEASURE).tokenize();
		cursor = 0;
		depth = 0;
		Expression expression = parseAdditive();
		if (peek().type() != TokenType.EOF) {
			throw unexpected(peek());
		}
		return expression;
	}

	private Expression parseAdditive() {
		Expression left = parseMultiplicative();
		while (true) {
			TokenType type = peek().type();
			if (type == TokenType.PLUS) {
				advance();
				left = new BinaryOperation(BinaryOperator.ADD, left, parseMultiplicative());
			} else if (type == TokenType.MINUS) {
				advance();
				left = new BinaryOperation(BinaryOperator.SUBTRACT, left, parseMultiplicative());
			} else {
				return left;
			}
		}
	}

	private Expression parseMultiplicative() {
		Expression left = parseUnary();
		while (true) {
			Token token = peek();
			if (token.type() == TokenType.STAR) {
				advance();
				left = new BinaryOperation(BinaryOperator.MULTIPLY, left, parseUnary());
			} else if (token.type() == TokenType.SLASH) {
				advance();
				left = new BinaryOperation(BinaryOperator.DIVIDE, left, parseUnary());
			} else if (token.type() == TokenType.PERCENT) {
				requireMeasureDialect(token);
				advance();
				left = new BinaryOperation(BinaryOperator.MODULO, left, parseUnary());
			} else {
				return left;
			}
		}
	}

	// Every nested group, sign and right-hand power operand passes through here.
	private Expression parseUnary() {
		Token token = peek();
		if (++depth > MAX_NESTING) {
			throw new ExpressionException("Expression nests deeper than " + MAX_NESTING + " levels at position "
					+ token.position(), token.position());
		}
		try {
			return parseSignedOperand(token);
		} finally {
			depth--;
		}
	}

	private Expression parseSignedOperand(Token token) {
		if (token.type() == TokenType.MINUS) {
			advance();
			return new UnaryOperation(true, parseUnary());
		}
		if (token.type() == TokenType.PLUS) {
			if (dialect == ExpressionDialect.MEASURE) {
				throw new ExpressionException("Unsupported unary operator '+' at position " + token.position(), token.position());
			}
			advance();
			return new UnaryOperation(false, parseUnary());
		}
		return parsePower();
	}

	// Right-associative and binds tighter than a leading minus: -2 ** 2 == -4.
	private Expression parsePower() {
		Expression base = parsePrimary();
		Token token = peek();
		if (token.type() == TokenType.DOUBLE_STAR) {
			requireMeasureDialect(token);
			advance();
			return new BinaryOperation(BinaryOperator.POWER, base, parseUnary());
		}
		return base;
	}

	private Expression parsePrimary() {
		Token token = advance();
		return switch (token.type()) {
			case NUMBER -> number(token);
			case IDENTIFIER -> identifier(token);
			case LPAREN -> {
				Expression inner = parseAdditive();
				expect(TokenType.RPAREN);
				yield inner;
			}
			default -> throw unexpected(token);
		};
	}

	private Expression number(Token token) {
		String text = token.text();
		if (dialect == ExpressionDialect.ROW_FORMULA && text.indexOf('.') < 0) {
			// 007 and 7 address the same row.
			return new VariableReference(new BigInteger(text).toString());
		}
		try {
			return new NumberLiteral(Double.parseDouble(text));
		} catch (NumberFormatException ex) {
			throw new ExpressionException("Invalid number " + token, token.position());
		}
	}

	private Expression identifier(Token token) {
		boolean call = peek().type() == TokenType.LPAREN;
		if (dialect == ExpressionDialect.MEASURE) {
			if (call) {
				throw new ExpressionException("Unsupported function call " + token, token.position());
			}
			return new VariableReference(token.text());
		}
		if (!SUM_FUNCTION.equals(token.text()) || !call) {
			throw new ExpressionException("Unsupported name " + token + " at position " + token.position(), token.position());
		}
		advance();
		List<Expression> arguments = new ArrayList<>();
		while (peek().type() != TokenType.RPAREN) {
			// Empty arguments, as in SUM(1;2;), are dropped.
			if (peek().type() == TokenType.SEMICOLON) {
				advance();
				continue;
			}
			arguments.add(parseAdditive());
			if (peek().type() != TokenType.SEMICOLON) {
				break;
			}
			advance();
		}
		expect(TokenType.RPAREN);
		return new SumFunction(arguments);
	}

	private void requireMeasureDialect(Token token) {
		if (dialect != ExpressionDialect.MEASURE) {
			throw new ExpressionException("Unsupported operator " + token + " at position " + token.position(), token.position());
		}
	}

	private Token expect(TokenType type) {
		Token token = advance();
		if (token.type() != type) {
			throw unexpected(token);
		}
		return token;
	}

	private Token peek() {
		return tokens.get(cursor);
	}

	private Token advance() {
		Token token = tokens.get(cursor);
		if (token.type() != TokenType.EOF) {
			cursor++;
		}
		return token;
	}

	private ExpressionException unexpected(Token token) {
		return new ExpressionException("Unexpected " + token + " at position " + token.position(), token.position());
	}
}
