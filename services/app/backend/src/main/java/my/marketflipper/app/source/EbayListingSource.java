package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;
import org.jsoup.nodes.Element;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

public class EbayListingSource extends HtmlListingSource {
	private static final Map<String, String> CATEGORY_IDS = Map.of(
			"electronics", "293",
			"computers", "58058",
			"phones", "9355"
	);
	private static final String UNKNOWN_TITLE = "Unknown";

	private final String category;
	private final String baseUrl;

	public EbayListingSource(RestClient restClient, Clock clock, String category, String baseUrl) {
		super(restClient, clock);
		this.category = category == null || category.isBlank() ? "electronics" : category;
		this.baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://www.ebay.com" : baseUrl;
	}

	@Override
	public String name() {
		return "ebay";
	}

	@Override
	protected String searchUrl() {
		return baseUrl + "/sch/i.html?_nkw=&_sacat=" + CATEGORY_IDS.getOrDefault(category, "293") + "&_sop=10";
	}

	@Override
	protected String baseUrl() {
		return baseUrl;
	}

	@Override
	protected String itemSelector() {
		return "div.s-item__info";
	}

	@Override
	protected Optional<Listing> toListing(Element item, int idx) {
		String title = text(item, "div.s-item__title", UNKNOWN_TITLE);
		if (title.contains("Shop on eBay") || UNKNOWN_TITLE.equals(title)) {
			return Optional.empty();
		}
		String price = text(item, "span.s-item__price", "$0");
		String url = href(item, "a.s-item__link");
		return Optional.of(new Listing(
				"ebay_" + idx + "_" + urlBucket(url),
				title,
				extractPrice(price),
				url,
				"ebay",
				category,
				now()));
	}
}
