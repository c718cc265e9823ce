package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;
import org.jsoup.nodes.Element;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

public class CraigslistListingSource extends HtmlListingSource {
	private static final Map<String, String> CATEGORY_PATHS = Map.of(
			"electronics", "/d/electronics/search/ela",
			"furniture", "/d/furniture/search/fua",
			"appliances", "/d/appliances/search/ppa"
	);
	private static final String DEFAULT_PATH = "/d/electronics/search/ela";

	private final String city;
	private final String category;
	private final String baseUrl;

	public CraigslistListingSource(RestClient restClient, Clock clock, String city, String category, String baseUrl) {
		super(restClient, clock);
		this.city = city == null || city.isBlank() ? "sfbay" : city;
		this.category = category == null || category.isBlank() ? "electronics" : category;
		this.baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://" + this.city + ".craigslist.org" : baseUrl;
	}

	@Override
	public String name() {
		return "craigslist";
	}

	@Override
	protected String searchUrl() {
		return baseUrl + CATEGORY_PATHS.getOrDefault(category, DEFAULT_PATH);
	}

	@Override
	protected String baseUrl() {
		return baseUrl;
	}

	@Override
	protected String itemSelector() {
		return "li.cl-static-search-result";
	}

	@Override
	protected Optional<Listing> toListing(Element item, int idx) {
		String title = text(item, "div.title", "Unknown");
		String price = text(item, "div.price", "$0");
		String url = href(item, "a");
		return Optional.of(new Listing(
				"cl_" + city + "_" + idx + "_" + urlBucket(url),
				title,
				extractPrice(price),
				url,
				"craigslist",
				category,
				now()));
	}
}
