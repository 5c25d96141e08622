package my.finsight.app.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Amounts {
	public static final int CURRENCY_SCALE = 2;

	private Amounts() {
	}

	// Half-even on the exact binary value: 2.675 is stored below the midpoint and rounds to 2.67.
	public static double round(double value, int scale) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return value;
		}
		return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
	}

	public static double roundCurrency(double value) {
		return round(value, CURRENCY_SCALE);
	}
}
