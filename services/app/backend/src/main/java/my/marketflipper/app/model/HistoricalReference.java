package my.marketflipper.app.model;

import java.math.BigDecimal;

public record HistoricalReference(String token,
								  BigDecimal avg,
								  BigDecimal min,
								  BigDecimal max,
								  BigDecimal msrp) {
}
