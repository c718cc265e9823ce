package my.marketflipper.app.service;

import my.marketflipper.app.model.CycleOutcome;
import my.marketflipper.app.model.CycleReport;
import my.marketflipper.app.model.Listing;
import my.marketflipper.app.model.SourceReport;
import my.marketflipper.app.model.ValuationThresholds;
import my.marketflipper.app.source.ListingSource;
import my.marketflipper.app.source.ScrapeSkip;
import my.marketflipper.app.source.SourceFetchResult;
import my.marketflipper.app.store.RecordStore;
import my.marketflipper.app.store.RecordStoreException;
import my.marketflipper.app.store.StoreCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static my.marketflipper.app.support.TestListings.CLOCK;
import static my.marketflipper.app.support.TestListings.defaultReferences;
import static my.marketflipper.app.support.TestListings.listing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlipperAgentServiceTest {
	@Mock
	private RecordStore store;

	@Mock
	private ListingSource craigslist;

	@Mock
	private ListingSource ebay;

	private FlipperAgentService service;

	@BeforeEach
	void setUp() {
		lenient().when(craigslist.name()).thenReturn("craigslist");
		lenient().when(ebay.name()).thenReturn("ebay");
		AllocationEngine engine = new AllocationEngine(CLOCK);
		service = new FlipperAgentService(
				List.of(craigslist, ebay),
				new ValuationModel(defaultReferences(), ValuationThresholds.defaults()),
				engine,
				new PurchaseExecutor(store, engine, CLOCK),
				store,
				CLOCK);
	}

	@Test
	void fullCycleBuysAndRelistsUndervaluedListings() {
		when(craigslist.fetch(20)).thenReturn(new SourceFetchResult("craigslist", List.of(
				listing("cl_1", "iPhone 13", "300"),
				listing("cl_2", "Sony PS5 Console", "440")), List.of()));
		when(ebay.fetch(20)).thenThrow(new IllegalStateException("blocked"));

		CycleReport report = service.runCycle(new BigDecimal("1000"), 20);

		assertThat(report.outcome()).isEqualTo(CycleOutcome.COMPLETED);
		assertThat(report.listingsScanned()).isEqualTo(2);
		assertThat(report.undervaluedCount()).isEqualTo(1);
		assertThat(report.sources()).extracting(SourceReport::source).containsExactly("craigslist", "ebay");
		assertThat(report.sources().get(1).error()).isEqualTo("blocked");
		assertThat(report.allocation().purchases()).extracting(p -> p.id()).containsExactly("cl_1");
		assertThat(report.stats().itemsPurchased()).isEqualTo(1);
		assertThat(report.stats().itemsListed()).isEqualTo(1);
		assertThat(report.stats().expectedProfit()).isEqualByComparingTo("350");
		verify(store).put(eq(StoreCollection.LISTINGS), eq("cl_2"), any());
		verify(store).put(eq(StoreCollection.LISTINGS), eq("resale_cl_1"), any());
	}

	@Test
	void secondCycleDoesNotRebuySameListing() {
		when(craigslist.fetch(5)).thenReturn(new SourceFetchResult("craigslist",
				List.of(listing("cl_1", "iPhone 13", "300")), List.of()));
		when(ebay.fetch(5)).thenReturn(SourceFetchResult.empty("ebay"));

		service.runCycle(new BigDecimal("1000"), 5);
		CycleReport second = service.runCycle(new BigDecimal("1000"), 5);

		assertThat(second.outcome()).isEqualTo(CycleOutcome.NO_PURCHASES);
		assertThat(service.stats().itemsPurchased()).isEqualTo(1);
	}

	@Test
	void endsEarlyWhenNothingIsFound() {
		when(craigslist.fetch(20)).thenReturn(SourceFetchResult.empty("craigslist"));
		when(ebay.fetch(20)).thenReturn(SourceFetchResult.empty("ebay"));

		CycleReport report = service.runCycle(new BigDecimal("1000"), 20);

		assertThat(report.outcome()).isEqualTo(CycleOutcome.NO_LISTINGS);
		assertThat(report.allocation()).isNull();
	}

	@Test
	void invalidListingsAreSkippedWithReasonAndNormalized() {
		when(craigslist.fetch(20)).thenReturn(new SourceFetchResult("craigslist", List.of(
				new Listing("cl_1", "  iPhone 13  ", new BigDecimal("300"), null, "CraigsList", null, null),
				new Listing("cl_2", " ", new BigDecimal("10"), null, "craigslist", null, null),
				new Listing("cl_3", "TV", new BigDecimal("10"), null, null, null, null)),
				List.of(new ScrapeSkip(7, "broken markup"))));
		when(ebay.fetch(20)).thenReturn(SourceFetchResult.empty("ebay"));
		doThrow(new RecordStoreException("read only", null))
				.when(store).put(eq(StoreCollection.LISTINGS), eq("cl_1"), any());

		CycleReport report = service.runCycle(new BigDecimal("1000"), 20);

		SourceReport craigslistReport = report.sources().get(0);
		assertThat(craigslistReport.fetched()).isEqualTo(3);
		assertThat(craigslistReport.accepted()).isEqualTo(1);
		assertThat(craigslistReport.stored()).isZero();
		assertThat(craigslistReport.skipped()).extracting(ScrapeSkip::reason)
				.containsExactly("broken markup", "Missing title", "Missing marketplace");
		assertThat(report.allocation().purchases()).singleElement().satisfies(item -> {
			assertThat(item.title()).isEqualTo("iPhone 13");
			assertThat(item.listing().marketplace()).isEqualTo("CraigsList");
		});
	}

	@Test
	void restoresPurchasedAndListedIdsFromStore() {
		when(store.listKeys(StoreCollection.INVENTORY)).thenReturn(List.of("cl_1", "cl_2"));
		when(store.listKeys(StoreCollection.LISTINGS)).thenReturn(List.of("cl_1", "resale_cl_1", "cl_9"));

		service.restoreState();

		assertThat(service.state().purchasedIds()).containsExactly("cl_1", "cl_2");
		assertThat(service.state().listedIds()).containsExactly("cl_1");
	}

	@Test
	void restoreFailureKeepsEmptyState() {
		when(store.listKeys(StoreCollection.INVENTORY)).thenThrow(new RecordStoreException("down", null));

		service.restoreState();

		assertThat(service.state().purchasedIds()).isEmpty();
	}

	@Test
	void rejectsInvalidCycleArguments() {
		assertThatThrownBy(() -> service.runCycle(new BigDecimal("-1"), 5)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.runCycle(BigDecimal.TEN, 0)).isInstanceOf(IllegalArgumentException.class);
	}
}
