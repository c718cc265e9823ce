package my.marketflipper.app.source;

import org.junit.jupiter.api.Test;

import static my.marketflipper.app.support.TestListings.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

class EbayListingSourceTest {
	private static final String HTML = """
			<ul>
			  <li><div class="s-item__info">
			    <a class="s-item__link" href="https://www.ebay.com/itm/0"><div class="s-item__title">Shop on eBay</div></a>
			    <span class="s-item__price">$20.00</span>
			  </div></li>
			  <li><div class="s-item__info">
			    <a class="s-item__link" href="https://www.ebay.com/itm/1"><div class="s-item__title">Apple Watch Series 8</div></a>
			    <span class="s-item__price">$210.50</span>
			  </div></li>
			  <li><div class="s-item__info">
			    <span class="s-item__price">$5.00</span>
			  </div></li>
			</ul>
			""";

	private final EbayListingSource source = new EbayListingSource(null, CLOCK, "phones", null);

	@Test
	void skipsPromotionalAndUntitledItems() {
		SourceFetchResult result = source.parse(HTML, 50);

		assertThat(result.listings()).singleElement().satisfies(listing -> {
			assertThat(listing.title()).isEqualTo("Apple Watch Series 8");
			assertThat(listing.price()).isEqualByComparingTo("210.50");
			assertThat(listing.id()).startsWith("ebay_1_");
			assertThat(listing.marketplace()).isEqualTo("ebay");
			assertThat(listing.category()).isEqualTo("phones");
		});
		assertThat(result.skipped()).extracting(ScrapeSkip::index).containsExactly(0, 2);
	}

	@Test
	void searchUrlUsesCategoryId() {
		assertThat(source.searchUrl()).isEqualTo("https://www.ebay.com/sch/i.html?_nkw=&_sacat=9355&_sop=10");
	}
}
