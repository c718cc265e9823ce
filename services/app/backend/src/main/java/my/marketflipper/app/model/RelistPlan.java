package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.util.List;

public record RelistPlan(List<Entry> entries, BigDecimal revenueAdded) {
	public record Entry(EvaluatedListing item, BigDecimal resalePrice) {
	}
}
