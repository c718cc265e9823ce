package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record TransactionRecord(TransactionType type,
								String itemId,
								BigDecimal amount,
								LocalDateTime timestamp) {
}
