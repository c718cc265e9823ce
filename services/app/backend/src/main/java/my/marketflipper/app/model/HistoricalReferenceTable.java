package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered price references keyed by a lowercase category token.
 * A title matches the first entry whose token occurs in it, so entry order decides overlapping tokens
 * ("ipad" before "laptop" etc.).
 */
public final class HistoricalReferenceTable {
	private final List<HistoricalReference> entries;

	public HistoricalReferenceTable(List<HistoricalReference> entries) {
		if (entries == null) {
			throw new IllegalArgumentException("Historical reference entries are required");
		}
		List<HistoricalReference> normalized = new ArrayList<>();
		for (HistoricalReference entry : entries) {
			normalized.add(normalize(entry));
		}
		this.entries = List.copyOf(normalized);
	}

	public Optional<HistoricalReference> match(String title) {
		if (title == null || title.isEmpty()) {
			return Optional.empty();
		}
		String lowered = title.toLowerCase(Locale.ROOT);
		for (HistoricalReference entry : entries) {
			if (lowered.contains(entry.token())) {
				return Optional.of(entry);
			}
		}
		return Optional.empty();
	}

	public List<HistoricalReference> entries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	private static HistoricalReference normalize(HistoricalReference entry) {
		if (entry == null) {
			throw new IllegalArgumentException("Historical reference entry must not be null");
		}
		if (entry.token() == null || entry.token().isBlank()) {
			throw new IllegalArgumentException("Historical reference token must not be blank");
		}
		if (entry.avg() == null || entry.avg().signum() <= 0) {
			throw new IllegalArgumentException("Historical reference '" + entry.token() + "' needs a positive avg");
		}
		return new HistoricalReference(
				entry.token().trim().toLowerCase(Locale.ROOT),
				entry.avg(),
				safe(entry.min()),
				safe(entry.max()),
				safe(entry.msrp()));
	}

	private static BigDecimal safe(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
