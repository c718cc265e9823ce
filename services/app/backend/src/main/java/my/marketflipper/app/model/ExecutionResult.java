package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.util.List;

public record ExecutionResult(List<ItemOutcome> outcomes, BigDecimal invested) {
	public long failures() {
		return outcomes.stream().filter(outcome -> !outcome.success()).count();
	}
}
