package my.finsight.app.expr;

import java.util.List;
import java.util.Set;

public record SumFunction(List<Expression> arguments) implements Expression {
	public SumFunction {
		arguments = List.copyOf(arguments);
	}

	@Override
	public double evaluate(VariableResolver variables) {
		double total = 0.0d;
		for (Expression argument : arguments) {
			total += argument.evaluate(variables);
		}
		return total;
	}

	@Override
	public void collectVariables(Set<String> into) {
		for (Expression argument : arguments) {
			argument.collectVariables(into);
		}
	}
}
