package my.finsight.app.expr;

import java.util.Set;

public record UnaryOperation(boolean negate, Expression operand) implements Expression {
	@Override
	public double evaluate(VariableResolver variables) {
		double value = operand.evaluate(variables);
		return negate ? -value : value;
	}

	@Override
	public void collectVariables(Set<String> into) {
		operand.collectVariables(into);
	}
}
