package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record InventoryRecord(Listing listing,
							  Evaluation evaluation,
							  InventoryStatus status,
							  LocalDateTime purchaseDate,
							  BigDecimal resalePrice,
							  LocalDateTime listedDate) {
	public InventoryRecord listed(BigDecimal price, LocalDateTime at) {
		return new InventoryRecord(listing, evaluation, InventoryStatus.LISTED, purchaseDate, price, at);
	}
}
