package my.marketflipper.app.model;

import java.math.BigDecimal;

public record EvaluatedListing(Listing listing, Evaluation evaluation) {
	public String id() {
		return listing == null ? null : listing.id();
	}

	public String title() {
		return listing == null ? null : listing.title();
	}

	public BigDecimal price() {
		return listing == null ? null : listing.price();
	}

	public BigDecimal score() {
		return evaluation == null ? null : evaluation.score();
	}

	public boolean undervalued() {
		return evaluation != null && evaluation.undervalued();
	}
}
