package my.finsight.app.expr;

import java.util.LinkedHashSet;
import java.util.Set;

public interface Expression {
	double evaluate(VariableResolver variables);

	void collectVariables(Set<String> into);

	default Set<String> variables() {
		Set<String> names = new LinkedHashSet<>();
		collectVariables(names);
		return names;
	}
}
