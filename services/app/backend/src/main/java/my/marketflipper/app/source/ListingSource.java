package my.marketflipper.app.source;

/**
 * A marketplace feed. Implementations may return fewer listings than requested and report
 * items they could not read as {@link ScrapeSkip}s instead of failing the whole fetch.
 */
public interface ListingSource {
	String name();

	SourceFetchResult fetch(int maxResults);
}
