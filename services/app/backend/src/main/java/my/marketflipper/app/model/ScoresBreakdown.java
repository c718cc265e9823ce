package my.marketflipper.app.model;

import java.math.BigDecimal;

public record ScoresBreakdown(BigDecimal historical,
							  BigDecimal msrp,
							  BigDecimal scarcity,
							  BigDecimal ratio) {
	public static ScoresBreakdown empty() {
		return new ScoresBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
	}
}
