package my.marketflipper.app.model;

import my.marketflipper.app.source.ScrapeSkip;

import java.util.List;

/**
 * Per-source scan summary. {@code error} is set when the source failed as a whole.
 */
public record SourceReport(String source,
						   int fetched,
						   int accepted,
						   int stored,
						   List<ScrapeSkip> skipped,
						   String error) {
	public static SourceReport failed(String source, String error) {
		return new SourceReport(source, 0, 0, 0, List.of(), error);
	}
}
