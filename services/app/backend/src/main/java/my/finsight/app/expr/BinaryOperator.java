package my.finsight.app.expr;

public enum BinaryOperator {
	ADD {
		@Override
		public double apply(double left, double right) {
			return left + right;
		}
	},
	SUBTRACT {
		@Override
		public double apply(double left, double right) {
			return left - right;
		}
	},
	MULTIPLY {
		@Override
		public double apply(double left, double right) {
			return left * right;
		}
	},
	DIVIDE {
		@Override
		public double apply(double left, double right) {
			if (right == 0.0d) {
				throw new ExpressionException("Division by zero");
			}
			return left / right;
		}
	},
	// Result takes the sign of the divisor.
	MODULO {
		@Override
		public double apply(double left, double right) {
			if (right == 0.0d) {
				throw new ExpressionException("Modulo by zero");
			}
			double remainder = left % right;
			if (remainder != 0.0d && (remainder < 0.0d) != (right < 0.0d)) {
				remainder += right;
			}
			return remainder;
		}
	},
	POWER {
		@Override
		public double apply(double left, double right) {
			if (left == 0.0d && right < 0.0d) {
				throw new ExpressionException("Zero cannot be raised to a negative power");
			}
			double result = Math.pow(left, right);
			if (Double.isNaN(result) || Double.isInfinite(result)) {
				throw new ExpressionException("Power " + left + " ** " + right + " has no real result");
			}
			return result;
		}
	};

	public abstract double apply(double left, double right);
}
