package my.finsight.app.expr;

public class ExpressionException extends RuntimeException {
	private final int position;

	public ExpressionException(String message) {
		this(message, -1);
	}

	public ExpressionException(String message, int position) {
		super(message);
		this.position = position;
	}

	public int getPosition() {
		return position;
	}
}
