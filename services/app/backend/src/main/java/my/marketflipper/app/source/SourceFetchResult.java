package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;

import java.util.List;

public record SourceFetchResult(String source, List<Listing> listings, List<ScrapeSkip> skipped) {
	public static SourceFetchResult empty(String source) {
		return new SourceFetchResult(source, List.of(), List.of());
	}
}
