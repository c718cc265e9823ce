package my.marketflipper.app.model;

import java.math.BigDecimal;

/**
 * Hard gates of the undervalued verdict. Each must hold independently; none is blended into the score.
 */
public record ValuationThresholds(BigDecimal minScore,
								  BigDecimal minProfitMargin,
								  BigDecimal minProfit) {
	public static final BigDecimal DEFAULT_MIN_SCORE = new BigDecimal("60");
	public static final BigDecimal DEFAULT_MIN_PROFIT_MARGIN = new BigDecimal("0.20");
	public static final BigDecimal DEFAULT_MIN_PROFIT = new BigDecimal("50");

	public static ValuationThresholds defaults() {
		return new ValuationThresholds(DEFAULT_MIN_SCORE, DEFAULT_MIN_PROFIT_MARGIN, DEFAULT_MIN_PROFIT);
	}

	public static ValuationThresholds of(BigDecimal minScore, BigDecimal minProfitMargin, BigDecimal minProfit) {
		return new ValuationThresholds(
				minScore == null ? DEFAULT_MIN_SCORE : minScore,
				minProfitMargin == null ? DEFAULT_MIN_PROFIT_MARGIN : minProfitMargin,
				minProfit == null ? DEFAULT_MIN_PROFIT : minProfit);
	}
}
