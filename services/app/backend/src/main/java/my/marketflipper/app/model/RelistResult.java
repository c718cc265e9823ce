package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.util.List;

public record RelistResult(List<RelistPlan.Entry> listed, List<ItemOutcome> outcomes, BigDecimal revenueAdded) {
	public long failures() {
		return outcomes.stream().filter(outcome -> !outcome.success()).count();
	}
}
