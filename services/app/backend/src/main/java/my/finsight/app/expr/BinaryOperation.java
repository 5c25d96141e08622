package my.finsight.app.expr;

import java.util.Set;

public record BinaryOperation(BinaryOperator operator, Expression left, Expression right) implements Expression {
	@Override
	public double evaluate(VariableResolver variables) {
		double lhs = left.evaluate(variables);
		double rhs = right.evaluate(variables);
		return operator.apply(lhs, rhs);
	}

	@Override
	public void collectVariables(Set<String> into) {
		left.collectVariables(into);
		right.collectVariables(into);
	}
}
