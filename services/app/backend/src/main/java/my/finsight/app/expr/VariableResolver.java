package my.finsight.app.expr;

import java.util.Map;

@FunctionalInterface
public interface VariableResolver {
	double resolve(String name);

	static VariableResolver strict(Map<String, Double> values) {
		return name -> {
			Double value = values.get(name);
			if (value == null) {
				throw new ExpressionException("Unknown variable in expression: " + name);
			}
			return value;
		};
	}
}
