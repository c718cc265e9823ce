package my.marketflipper.app.service;

import my.marketflipper.app.model.AllocationResult;
import my.marketflipper.app.model.Decision;
import my.marketflipper.app.model.DecisionAction;
import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.RelistPlan;
import my.marketflipper.app.model.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy best-first budget allocation over a score-ranked list.
 * An item that does not fit the remaining budget is skipped and the scan continues, so a cheaper
 * item further down can still be bought.
 */
@Service
public class AllocationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AllocationEngine.class);
	private static final BigDecimal RESALE_MARKUP = new BigDecimal("1.3");

	private final Clock clock;

	public AllocationEngine(Clock clock) {
		this.clock = clock;
	}

	public AllocationResult allocate(List<EvaluatedListing> ranked, BigDecimal budget, AllocationState state) {
		validate(ranked, budget, state);
		state.startPass(budget);
		logger.info("Allocating budget {} across {} ranked listings", budget, ranked.size());

		List<EvaluatedListing> purchases = new ArrayList<>();
		List<Decision> accepted = new ArrayList<>();
		List<Decision> skipped = new ArrayList<>();
		for (EvaluatedListing item : ranked) {
			if (state.hasPurchased(item.id())) {
				skipped.add(skip(item, SkipReason.ALREADY_PURCHASED, "Already purchased this item"));
				continue;
			}
			if (!item.undervalued()) {
				skipped.add(skip(item, SkipReason.NOT_UNDERVALUED, "Not undervalued"));
				continue;
			}
			BigDecimal price = item.price();
			if (price.compareTo(state.remainingBudget()) > 0) {
				logger.info("Skipping {} - price {} exceeds remaining budget {}",
						abbreviate(item.title()), price, state.remainingBudget());
				skipped.add(skip(item, SkipReason.EXCEEDS_BUDGET,
						"Exceeds remaining budget: " + price.toPlainString() + " > " + state.remainingBudget().toPlainString()));
				continue;
			}
			Decision decision = new Decision(
					DecisionAction.BUY,
					null,
					item.id(),
					item.title(),
					price,
					item.score(),
					item.evaluation().profitPotential(),
					item.evaluation().reasoning(),
					LocalDateTime.now(clock));
			state.accept(item.id(), price);
			purchases.add(item);
			accepted.add(decision);
			logger.info("Purchase decision: {} (price={}, profit={}, remaining={})",
					abbreviate(item.title()), price, decision.profitPotential(), state.remainingBudget());
		}
		BigDecimal spent = budget.subtract(state.remainingBudget());
		logger.info("Selected {} purchases, investing {}", purchases.size(), spent);
		return new AllocationResult(
				List.copyOf(purchases),
				List.copyOf(accepted),
				List.copyOf(skipped),
				budget,
				spent,
				state.remainingBudget());
	}

	/**
	 * Marks not-yet-listed purchases as listed and prices them for resale.
	 * Ids already listed, including duplicates within {@code purchases}, are left alone.
	 */
	public RelistPlan planRelist(List<EvaluatedListing> purchases, AllocationState state) {
		if (state == null) {
			throw new AllocationInputException("Allocation state is required");
		}
		if (purchases == null || purchases.isEmpty()) {
			return new RelistPlan(List.of(), BigDecimal.ZERO);
		}
		validateItems(purchases);
		List<RelistPlan.Entry> entries = new ArrayList<>();
		BigDecimal revenue = BigDecimal.ZERO;
		for (EvaluatedListing item : purchases) {
			if (state.isListed(item.id())) {
				continue;
			}
			BigDecimal resalePrice = resalePrice(item);
			state.markListed(item.id(), resalePrice);
			entries.add(new RelistPlan.Entry(item, resalePrice));
			revenue = revenue.add(resalePrice);
		}
		return new RelistPlan(List.copyOf(entries), revenue);
	}

	static BigDecimal resalePrice(EvaluatedListing item) {
		BigDecimal estimated = item.evaluation().estimatedResale();
		if (estimated != null) {
			return estimated;
		}
		return item.price().multiply(RESALE_MARKUP).setScale(2, RoundingMode.HALF_UP);
	}

	private Decision skip(EvaluatedListing item, SkipReason reason, String reasoning) {
		return new Decision(
				DecisionAction.SKIP,
				reason,
				item.id(),
				item.title(),
				item.price(),
				item.score(),
				item.evaluation().profitPotential(),
				reasoning,
				LocalDateTime.now(clock));
	}

	private void validate(List<EvaluatedListing> ranked, BigDecimal budget, AllocationState state) {
		if (state == null) {
			throw new AllocationInputException("Allocation state is required");
		}
		if (budget == null || budget.signum() < 0) {
			throw new AllocationInputException("Budget must be zero or positive");
		}
		if (ranked == null) {
			throw new AllocationInputException("Ranked listings are required");
		}
		validateItems(ranked);
	}

	private void validateItems(List<EvaluatedListing> items) {
		Set<Integer> broken = new LinkedHashSet<>();
		for (int i = 0; i < items.size(); i++) {
			EvaluatedListing item = items.get(i);
			if (item == null
					|| item.listing() == null
					|| item.evaluation() == null
					|| item.id() == null
					|| item.id().isBlank()
					|| item.price() == null
					|| item.score() == null) {
				broken.add(i);
			}
		}
		if (!broken.isEmpty()) {
			throw new AllocationInputException("Malformed evaluated listings at positions " + broken);
		}
	}

	private static String abbreviate(String title) {
		if (title == null) {
			return "";
		}
		return title.length() <= 50 ? title : title.substring(0, 50);
	}
}
