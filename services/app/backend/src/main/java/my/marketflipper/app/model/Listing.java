package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single marketplace offer as delivered by a listing source.
 * Only {@code id}, {@code title} and {@code price} are interpreted by the valuation and allocation engines;
 * the remaining fields are carried through unchanged.
 */
public record Listing(String id,
					  String title,
					  BigDecimal price,
					  String url,
					  String marketplace,
					  String category,
					  LocalDateTime timestamp) {
}
