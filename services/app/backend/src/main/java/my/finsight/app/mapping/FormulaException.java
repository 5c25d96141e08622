package my.finsight.app.mapping;

public class FormulaException extends MappingTemplateException {
	private final int rowId;
	private final String formula;

	public FormulaException(int rowId, String formula, String message, Throwable cause) {
		super("Invalid formula for row " + rowId + " (" + formula + "): " + message, cause);
		this.rowId = rowId;
		this.formula = formula;
	}

	public int getRowId() {
		return rowId;
	}

	public String getFormula() {
		return formula;
	}
}
