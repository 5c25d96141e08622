package my.finsight.app.expr;

/**
 * Grammar variants accepted by {@link ExpressionParser}.
 */
public enum ExpressionDialect {
	/**
	 * Statement row formulas: integer tokens are row ids, decimal tokens are literals,
	 * {@code SUM(a;b;...)} is the only function and only {@code + - * /} are allowed.
	 */
	ROW_FORMULA,
	/**
	 * Measure and ratio formulas: identifiers name measures, numbers may use exponent
	 * notation and {@code + - * / % **} are allowed. No function calls.
	 */
	MEASURE
}
