package my.marketflipper.app.service;

import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.Evaluation;
import my.marketflipper.app.model.HistoricalReference;
import my.marketflipper.app.model.HistoricalReferenceTable;
import my.marketflipper.app.model.Listing;
import my.marketflipper.app.model.ScoresBreakdown;
import my.marketflipper.app.model.ValuationThresholds;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores listings against historical price references.
 * Stateless: the result depends only on the listing and the reference table.
 */
@Service
public class ValuationModel {
	static final String INVALID_PRICE = "Invalid price";
	static final String NO_HISTORICAL_DATA = "No historical data available";

	private static final BigDecimal ZERO = BigDecimal.ZERO;
	private static final BigDecimal ONE = BigDecimal.ONE;
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	private static final BigDecimal HISTORICAL_FACTOR = new BigDecimal("200");
	private static final BigDecimal MSRP_FACTOR = new BigDecimal("150");
	private static final BigDecimal RATIO_FACTOR = new BigDecimal("200");
	private static final BigDecimal SCARCITY_BASELINE = new BigDecimal("50");
	private static final BigDecimal SCARCITY_BONUS = new BigDecimal("20");
	private static final BigDecimal DEMAND_BONUS = new BigDecimal("10");

	private static final BigDecimal WEIGHT_HISTORICAL = new BigDecimal("0.40");
	private static final BigDecimal WEIGHT_MSRP = new BigDecimal("0.25");
	private static final BigDecimal WEIGHT_SCARCITY = new BigDecimal("0.20");
	private static final BigDecimal WEIGHT_RATIO = new BigDecimal("0.15");

	private static final BigDecimal REASON_HISTORICAL = new BigDecimal("60");
	private static final BigDecimal REASON_MSRP = new BigDecimal("60");
	private static final BigDecimal REASON_SCARCITY = new BigDecimal("70");
	private static final BigDecimal REASON_MARGIN = new BigDecimal("0.30");

	private static final List<String> SCARCITY_KEYWORDS = List.of("limited", "rare", "discontinued", "collectors");
	private static final List<String> DEMAND_KEYWORDS = List.of("pro", "max", "ultra", "premium");
	private static final int SCALE = 8;

	private final HistoricalReferenceTable references;
	private final ValuationThresholds thresholds;

	public ValuationModel(HistoricalReferenceTable references, ValuationThresholds thresholds) {
		this.references = references;
		this.thresholds = thresholds == null ? ValuationThresholds.defaults() : thresholds;
	}

	public Evaluation evaluate(Listing listing) {
		BigDecimal price = listing == null ? null : listing.price();
		if (price == null || price.signum() <= 0) {
			return Evaluation.noValue(INVALID_PRICE);
		}
		String title = listing.title() == null ? "" : listing.title().toLowerCase(Locale.ROOT);
		Optional<HistoricalReference> match = references.match(title);
		if (match.isEmpty()) {
			return Evaluation.noValue(NO_HISTORICAL_DATA);
		}
		HistoricalReference reference = match.get();

		BigDecimal avg = reference.avg();
		BigDecimal msrpBase = positiveOrOne(reference.msrp());
		BigDecimal historicalScaled = scaledHistoricalScore(price, avg);
		BigDecimal msrpScaled = scaledMsrpScore(price, reference.msrp());
		BigDecimal scarcity = scarcityScore(title);
		BigDecimal ratioScaled = scaledPriceRatioScore(price, avg);

		// total * avg * msrpBase, kept exact so the score gate sees no rounding
		BigDecimal scaledTotal = historicalScaled.multiply(WEIGHT_HISTORICAL).multiply(msrpBase)
				.add(msrpScaled.multiply(WEIGHT_MSRP).multiply(avg))
				.add(scarcity.multiply(WEIGHT_SCARCITY).multiply(avg).multiply(msrpBase))
				.add(ratioScaled.multiply(WEIGHT_RATIO).multiply(msrpBase));
		BigDecimal total = scaledTotal.divide(avg.multiply(msrpBase), SCALE, RoundingMode.HALF_UP);

		BigDecimal estimatedResale = avg;
		BigDecimal profit = estimatedResale.subtract(price);
		BigDecimal margin = profit.divide(price, SCALE, RoundingMode.HALF_UP);

		boolean undervalued = scaledTotal.compareTo(thresholds.minScore().multiply(avg).multiply(msrpBase)) >= 0
				&& profit.compareTo(price.multiply(thresholds.minProfitMargin())) >= 0
				&& profit.compareTo(thresholds.minProfit()) > 0;

		List<String> reasons = new ArrayList<>();
		if (historicalScaled.compareTo(REASON_HISTORICAL.multiply(avg)) > 0) {
			reasons.add("Price is significantly below historical average");
		}
		if (msrpScaled.compareTo(REASON_MSRP.multiply(msrpBase)) > 0) {
			reasons.add("Deep discount from MSRP");
		}
		if (scarcity.compareTo(REASON_SCARCITY) > 0) {
			reasons.add("High demand or scarcity indicators");
		}
		if (profit.compareTo(price.multiply(REASON_MARGIN)) >= 0) {
			BigDecimal pct = profit.multiply(ONE_HUNDRED).divide(price, 0, RoundingMode.HALF_EVEN);
			reasons.add("Excellent profit margin (" + pct.toPlainString() + "%)");
		}
		if (reasons.isEmpty()) {
			reasons.add("Price is close to market average");
		}

		BigDecimal historical = historicalScaled.divide(avg, SCALE, RoundingMode.HALF_UP);
		BigDecimal msrp = msrpScaled.divide(msrpBase, SCALE, RoundingMode.HALF_UP);
		BigDecimal ratio = ratioScaled.divide(avg, SCALE, RoundingMode.HALF_UP);
		return new Evaluation(
				undervalued,
				round(total, 2),
				round(estimatedResale, 2),
				round(profit, 2),
				round(margin, 4),
				String.join("; ", reasons),
				new ScoresBreakdown(round(historical, 2), round(msrp, 2), round(scarcity, 2), round(ratio, 2)));
	}

	/**
	 * Evaluates every listing and orders the results by score, highest first.
	 * Equal scores keep their input order; the allocator relies on this.
	 */
	public List<EvaluatedListing> batchEvaluate(List<Listing> listings) {
		if (listings == null || listings.isEmpty()) {
			return List.of();
		}
		List<EvaluatedListing> results = new ArrayList<>(listings.size());
		for (Listing listing : listings) {
			results.add(new EvaluatedListing(listing, evaluate(listing)));
		}
		results.sort(Comparator.comparing(EvaluatedListing::score).reversed());
		return List.copyOf(results);
	}

	public HistoricalReferenceTable references() {
		return references;
	}

	static BigDecimal historicalScore(BigDecimal price, BigDecimal avg) {
		return scaledHistoricalScore(price, avg).divide(positiveOrOne(avg), SCALE, RoundingMode.HALF_UP);
	}

	static BigDecimal msrpScore(BigDecimal price, BigDecimal msrp) {
		return scaledMsrpScore(price, msrp).divide(positiveOrOne(msrp), SCALE, RoundingMode.HALF_UP);
	}

	static BigDecimal scarcityScore(String loweredTitle) {
		BigDecimal score = SCARCITY_BASELINE;
		for (String keyword : SCARCITY_KEYWORDS) {
			if (loweredTitle.contains(keyword)) {
				score = score.add(SCARCITY_BONUS);
			}
		}
		for (String keyword : DEMAND_KEYWORDS) {
			if (loweredTitle.contains(keyword)) {
				score = score.add(DEMAND_BONUS);
			}
		}
		return capped(score);
	}

	static BigDecimal priceRatioScore(BigDecimal price, BigDecimal avg) {
		return scaledPriceRatioScore(price, avg).divide(positiveOrOne(avg), SCALE, RoundingMode.HALF_UP);
	}

	/** Historical score multiplied by {@code avg}. */
	private static BigDecimal scaledHistoricalScore(BigDecimal price, BigDecimal avg) {
		if (avg == null || avg.signum() <= 0 || price.compareTo(avg) >= 0) {
			return ZERO;
		}
		return avg.subtract(price).multiply(HISTORICAL_FACTOR).min(avg.multiply(ONE_HUNDRED));
	}

	/** MSRP score multiplied by {@code msrp}. */
	private static BigDecimal scaledMsrpScore(BigDecimal price, BigDecimal msrp) {
		if (msrp == null || msrp.signum() <= 0 || price.compareTo(msrp) >= 0) {
			return ZERO;
		}
		return msrp.subtract(price).multiply(MSRP_FACTOR).min(msrp.multiply(ONE_HUNDRED));
	}

	/** Price ratio score multiplied by {@code avg}. */
	private static BigDecimal scaledPriceRatioScore(BigDecimal price, BigDecimal avg) {
		if (avg == null || avg.signum() <= 0 || price.compareTo(avg) >= 0) {
			return ZERO;
		}
		if (price.add(price).compareTo(avg) <= 0) {
			return avg.multiply(ONE_HUNDRED);
		}
		return avg.subtract(price).multiply(RATIO_FACTOR);
	}

	private static BigDecimal positiveOrOne(BigDecimal value) {
		return value == null || value.signum() <= 0 ? ONE : value;
	}

	private static BigDecimal capped(BigDecimal value) {
		if (value.compareTo(ONE_HUNDRED) > 0) {
			return ONE_HUNDRED;
		}
		if (value.signum() < 0) {
			return ZERO;
		}
		return value;
	}

	private static BigDecimal round(BigDecimal value, int scale) {
		return value.setScale(scale, RoundingMode.HALF_UP);
	}
}
