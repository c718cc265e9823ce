package my.marketflipper.app.model;

import java.math.BigDecimal;

/**
 * Outcome of scoring one listing against the historical reference table.
 * {@code profitMargin} is a fraction of the asking price (0.25 means 25%).
 */
public record Evaluation(boolean undervalued,
						 BigDecimal score,
						 BigDecimal estimatedResale,
						 BigDecimal profitPotential,
						 BigDecimal profitMargin,
						 String reasoning,
						 ScoresBreakdown scores) {
	public static Evaluation noValue(String reasoning) {
		return new Evaluation(false,
				BigDecimal.ZERO,
				BigDecimal.ZERO,
				BigDecimal.ZERO,
				BigDecimal.ZERO,
				reasoning,
				ScoresBreakdown.empty());
	}
}
