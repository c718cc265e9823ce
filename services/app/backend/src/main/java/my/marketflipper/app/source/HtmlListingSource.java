package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for sources that scrape a search result page. Subclasses turn one result element into a listing.
 */
public abstract class HtmlListingSource implements ListingSource {
	private static final Logger logger = LoggerFactory.getLogger(HtmlListingSource.class);

	private final RestClient restClient;
	protected final Clock clock;

	protected HtmlListingSource(RestClient restClient, Clock clock) {
		this.restClient = restClient;
		this.clock = clock;
	}

	@Override
	public SourceFetchResult fetch(int maxResults) {
		String url = searchUrl();
		logger.info("Scraping {}: {}", name(), url);
		String html;
		try {
			html = restClient.get().uri(url).retrieve().body(String.class);
		} catch (RestClientException ex) {
			logger.warn("Request failed for {}: {}", url, ex.getMessage());
			return SourceFetchResult.empty(name());
		}
		if (html == null || html.isBlank()) {
			logger.warn("Empty response from {}", url);
			return SourceFetchResult.empty(name());
		}
		SourceFetchResult result = parse(html, maxResults);
		logger.info("Scraped {} {} listings ({} skipped)", result.listings().size(), name(), result.skipped().size());
		return result;
	}

	public SourceFetchResult parse(String html, int maxResults) {
		Document document = Jsoup.parse(html, baseUrl());
		List<Element> items = document.select(itemSelector());
		int limit = Math.min(Math.max(0, maxResults), items.size());
		List<Listing> listings = new ArrayList<>();
		List<ScrapeSkip> skipped = new ArrayList<>();
		for (int idx = 0; idx < limit; idx++) {
			try {
				Optional<Listing> listing = toListing(items.get(idx), idx);
				if (listing.isPresent()) {
					listings.add(listing.get());
				} else {
					skipped.add(new ScrapeSkip(idx, "Sponsored or untitled result"));
				}
			} catch (RuntimeException ex) {
				logger.debug("Error parsing {} listing {}: {}", name(), idx, ex.getMessage());
				skipped.add(new ScrapeSkip(idx, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
			}
		}
		return new SourceFetchResult(name(), List.copyOf(listings), List.copyOf(skipped));
	}

	protected abstract String searchUrl();

	protected abstract String baseUrl();

	protected abstract String itemSelector();

	/**
	 * @return the listing, or empty when the element is not a real offer
	 */
	protected abstract Optional<Listing> toListing(Element item, int idx);

	protected LocalDateTime now() {
		return LocalDateTime.now(clock);
	}

	protected static String text(Element parent, String selector, String fallback) {
		Element element = parent.selectFirst(selector);
		if (element == null) {
			return fallback;
		}
		String text = element.text().trim();
		return text.isEmpty() ? fallback : text;
	}

	protected static String href(Element parent, String selector) {
		Element element = parent.selectFirst(selector);
		if (element == null || !element.hasAttr("href")) {
			return "";
		}
		return element.attr("href");
	}

	/**
	 * Keeps digits and dots only; anything unparsable is a zero price.
	 */
	static BigDecimal extractPrice(String raw) {
		if (raw == null || raw.isEmpty()) {
			return BigDecimal.ZERO;
		}
		StringBuilder cleaned = new StringBuilder();
		for (char c : raw.toCharArray()) {
			if (Character.isDigit(c) || c == '.') {
				cleaned.append(c);
			}
		}
		try {
			return new BigDecimal(cleaned.toString());
		} catch (NumberFormatException ex) {
			return BigDecimal.ZERO;
		}
	}

	static int urlBucket(String url) {
		return Math.floorMod(url == null ? 0 : url.hashCode(), 10000);
	}
}
