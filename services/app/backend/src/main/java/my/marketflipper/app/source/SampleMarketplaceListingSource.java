package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline marketplace that generates plausible electronics offers. Used where no scrapeable feed exists
 * and for demos; a fixed seed makes the output repeatable.
 */
public class SampleMarketplaceListingSource implements ListingSource {
	private static final Logger logger = LoggerFactory.getLogger(SampleMarketplaceListingSource.class);
	private static final int MAX_RESULTS = 30;
	private static final List<String> PRODUCTS = List.of(
			"iPhone 12 Pro Max 128GB",
			"Sony PS5 Console",
			"MacBook Air M1",
			"Samsung 55\" 4K TV",
			"iPad Pro 11 inch",
			"Dell XPS 13 Laptop",
			"Canon EOS Camera",
			"Nintendo Switch OLED",
			"AirPods Pro 2nd Gen",
			"Samsung Galaxy S23",
			"HP Gaming Laptop",
			"Bose QuietComfort Headphones",
			"Apple Watch Series 8",
			"Fitbit Charge 5",
			"Ring Video Doorbell"
	);
	private static final Map<String, int[]> PRICE_RANGES = new LinkedHashMap<>();
	private static final int[] DEFAULT_RANGE = {100, 500};

	static {
		PRICE_RANGES.put("iPhone", new int[]{400, 900});
		PRICE_RANGES.put("MacBook", new int[]{600, 1200});
		PRICE_RANGES.put("PS5", new int[]{350, 550});
		PRICE_RANGES.put("TV", new int[]{200, 600});
		PRICE_RANGES.put("iPad", new int[]{300, 800});
		PRICE_RANGES.put("Dell", new int[]{400, 900});
		PRICE_RANGES.put("Canon", new int[]{300, 700});
		PRICE_RANGES.put("Switch", new int[]{200, 350});
		PRICE_RANGES.put("AirPods", new int[]{100, 200});
		PRICE_RANGES.put("Galaxy", new int[]{400, 800});
		PRICE_RANGES.put("HP", new int[]{500, 1000});
		PRICE_RANGES.put("Bose", new int[]{150, 300});
		PRICE_RANGES.put("Watch", new int[]{250, 450});
		PRICE_RANGES.put("Fitbit", new int[]{80, 150});
		PRICE_RANGES.put("Ring", new int[]{80, 150});
	}

	private final String location;
	private final String category;
	private final Random random;
	private final Clock clock;

	public SampleMarketplaceListingSource(String location, String category, Random random, Clock clock) {
		this.location = location == null || location.isBlank() ? "san-francisco" : location;
		this.category = category == null || category.isBlank() ? "electronics" : category;
		this.random = random == null ? new Random() : random;
		this.clock = clock;
	}

	@Override
	public String name() {
		return "facebook";
	}

	@Override
	public synchronized SourceFetchResult fetch(int maxResults) {
		int count = Math.min(Math.max(0, maxResults), MAX_RESULTS);
		List<Listing> listings = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			String product = PRODUCTS.get(random.nextInt(PRODUCTS.size()));
			int[] range = rangeFor(product);
			double raw = range[0] + random.nextDouble() * (range[1] - range[0]);
			BigDecimal price = BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP);
			listings.add(new Listing(
					"fb_" + location + "_" + i + "_" + (1000 + random.nextInt(9000)),
					product + " - Great Condition",
					price,
					"https://facebook.com/marketplace/item/" + (100000000 + random.nextInt(900000000)),
					name(),
					category,
					LocalDateTime.now(clock)));
		}
		logger.info("Generated {} sample marketplace listings", listings.size());
		return new SourceFetchResult(name(), List.copyOf(listings), List.of());
	}

	static int[] rangeFor(String product) {
		for (Map.Entry<String, int[]> entry : PRICE_RANGES.entrySet()) {
			if (product.contains(entry.getKey())) {
				return entry.getValue();
			}
		}
		return DEFAULT_RANGE;
	}
}
