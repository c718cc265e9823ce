package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.util.List;

public record AllocationResult(List<EvaluatedListing> purchases,
							   List<Decision> decisions,
							   List<Decision> skipped,
							   BigDecimal budget,
							   BigDecimal spent,
							   BigDecimal remainingBudget) {
}
