package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One allocator verdict. {@code skipReason} is only set for {@link DecisionAction#SKIP}.
 */
public record Decision(DecisionAction action,
					   SkipReason skipReason,
					   String itemId,
					   String title,
					   BigDecimal price,
					   BigDecimal score,
					   BigDecimal profitPotential,
					   String reasoning,
					   LocalDateTime timestamp) {
}
