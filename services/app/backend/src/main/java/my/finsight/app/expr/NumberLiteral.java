package my.finsight.app.expr;

import java.util.Set;

public record NumberLiteral(double value) implements Expression {
	@Override
	public double evaluate(VariableResolver variables) {
		return value;
	}

	@Override
	public void collectVariables(Set<String> into) {
	}
}
