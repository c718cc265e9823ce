package my.marketflipper.app.source;

import my.marketflipper.app.model.Listing;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static my.marketflipper.app.support.TestListings.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

class SampleMarketplaceListingSourceTest {
	@Test
	void seededSourcesProduceSameListings() {
		List<Listing> first = new SampleMarketplaceListingSource("oakland", null, new Random(7), CLOCK).fetch(10).listings();
		List<Listing> second = new SampleMarketplaceListingSource("oakland", null, new Random(7), CLOCK).fetch(10).listings();

		assertThat(first).hasSize(10).isEqualTo(second);
		assertThat(first).allSatisfy(listing -> {
			assertThat(listing.id()).startsWith("fb_oakland_");
			assertThat(listing.title()).endsWith(" - Great Condition");
			assertThat(listing.marketplace()).isEqualTo("facebook");
			assertThat(listing.price().signum()).isPositive();
		});
	}

	@Test
	void capsResultCount() {
		SampleMarketplaceListingSource source = new SampleMarketplaceListingSource(null, null, new Random(1), CLOCK);

		assertThat(source.fetch(500).listings()).hasSize(30);
		assertThat(source.fetch(-1).listings()).isEmpty();
	}

	@Test
	void pricesStayWithinProductRange() {
		SampleMarketplaceListingSource source = new SampleMarketplaceListingSource(null, null, new Random(3), CLOCK);

		for (Listing listing : source.fetch(30).listings()) {
			int[] range = SampleMarketplaceListingSource.rangeFor(listing.title());
			assertThat(listing.price().doubleValue()).isBetween((double) range[0], (double) range[1]);
		}
		assertThat(SampleMarketplaceListingSource.rangeFor("Fitbit Charge 5")).containsExactly(80, 150);
		assertThat(SampleMarketplaceListingSource.rangeFor("Unknown thing")).containsExactly(100, 500);
	}
}
