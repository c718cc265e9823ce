package my.marketflipper.app.config;

import my.marketflipper.app.source.CraigslistListingSource;
import my.marketflipper.app.source.EbayListingSource;
import my.marketflipper.app.source.SampleMarketplaceListingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

@Configuration
public class ListingSourceConfig {
	private static final Logger logger = LoggerFactory.getLogger(ListingSourceConfig.class);
	private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
			+ "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
	private static final int DEFAULT_TIMEOUT_SECONDS = 10;

	@Bean
	public RestClient listingRestClient(AppProperties properties) {
		Integer timeoutSeconds = properties.sources() == null ? null : properties.sources().timeoutSeconds();
		Duration timeout = Duration.ofSeconds(timeoutSeconds == null
				? DEFAULT_TIMEOUT_SECONDS
				: Math.max(1, timeoutSeconds));
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(timeout);
		requestFactory.setReadTimeout(timeout);
		return RestClient.builder()
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
				.defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml")
				.build();
	}

	@Bean
	@ConditionalOnProperty(name = "app.sources.craigslist.enabled", havingValue = "true")
	public CraigslistListingSource craigslistListingSource(AppProperties properties, RestClient listingRestClient, Clock clock) {
		AppProperties.Sources.Craigslist config = properties.sources().craigslist();
		String city = blankToDefault(config.city(), "sfbay");
		String category = blankToDefault(config.category(), "electronics");
		logger.info("Listing source enabled (craigslist, city={}, category={}).", city, category);
		return new CraigslistListingSource(listingRestClient, clock, city, category, config.baseUrl());
	}

	@Bean
	@ConditionalOnProperty(name = "app.sources.ebay.enabled", havingValue = "true")
	public EbayListingSource ebayListingSource(AppProperties properties, RestClient listingRestClient, Clock clock) {
		AppProperties.Sources.Ebay config = properties.sources().ebay();
		String category = blankToDefault(config.category(), "electronics");
		logger.info("Listing source enabled (ebay, category={}).", category);
		return new EbayListingSource(listingRestClient, clock, category, config.baseUrl());
	}

	@Bean
	@ConditionalOnProperty(name = "app.sources.sample.enabled", havingValue = "true", matchIfMissing = true)
	public SampleMarketplaceListingSource sampleMarketplaceListingSource(AppProperties properties, Clock clock) {
		AppProperties.Sources.Sample config = properties.sources().sample();
		Random random = config.seed() == null ? new Random() : new Random(config.seed());
		logger.info("Listing source enabled (sample, seeded={}).", config.seed() != null);
		return new SampleMarketplaceListingSource(
				blankToDefault(config.location(), "san-francisco"),
				blankToDefault(config.category(), "electronics"),
				random,
				clock);
	}

	private static String blankToDefault(String value, String fallback) {
		return value == null || value.isBlank() ? fallback : value.trim();
	}
}
