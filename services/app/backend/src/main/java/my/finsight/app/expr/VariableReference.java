package my.finsight.app.expr;

import java.util.Set;

public record VariableReference(String name) implements Expression {
	@Override
	public double evaluate(VariableResolver variables) {
		return variables.resolve(name);
	}

	@Override
	public void collectVariables(Set<String> into) {
		into.add(name);
	}
}
