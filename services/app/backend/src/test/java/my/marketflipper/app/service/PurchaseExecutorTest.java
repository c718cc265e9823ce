package my.marketflipper.app.service;

import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.ExecutionResult;
import my.marketflipper.app.model.InventoryRecord;
import my.marketflipper.app.model.InventoryStatus;
import my.marketflipper.app.model.ItemOutcome;
import my.marketflipper.app.model.RelistResult;
import my.marketflipper.app.model.TransactionRecord;
import my.marketflipper.app.model.TransactionType;
import my.marketflipper.app.store.RecordStore;
import my.marketflipper.app.store.RecordStoreException;
import my.marketflipper.app.store.StoreCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static my.marketflipper.app.support.TestListings.CLOCK;
import static my.marketflipper.app.support.TestListings.NOW;
import static my.marketflipper.app.support.TestListings.undervalued;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PurchaseExecutorTest {
	@Mock
	private RecordStore store;

	private PurchaseExecutor executor;

	@BeforeEach
	void setUp() {
		executor = new PurchaseExecutor(store, new AllocationEngine(CLOCK), CLOCK);
	}

	@Test
	void writesInventoryAndTransactionPerPurchase() {
		AllocationState state = new AllocationState();

		ExecutionResult result = executor.execute(List.of(undervalued("a", "120", "90", "200")), state);

		String transactionKey = "buy_a_" + NOW.getEpochSecond();
		assertThat(result.outcomes()).containsExactly(ItemOutcome.ok("a", transactionKey));
		assertThat(result.invested()).isEqualByComparingTo("120");

		ArgumentCaptor<Object> inventory = ArgumentCaptor.forClass(Object.class);
		verify(store).put(eq(StoreCollection.INVENTORY), eq("a"), inventory.capture());
		assertThat(inventory.getValue()).isInstanceOfSatisfying(InventoryRecord.class,
				record -> assertThat(record.status()).isEqualTo(InventoryStatus.PURCHASED));

		ArgumentCaptor<Object> transaction = ArgumentCaptor.forClass(Object.class);
		verify(store).put(eq(StoreCollection.TRANSACTIONS), eq(transactionKey), transaction.capture());
		assertThat(transaction.getValue()).isInstanceOfSatisfying(TransactionRecord.class, record -> {
			assertThat(record.type()).isEqualTo(TransactionType.PURCHASE);
			assertThat(record.amount()).isEqualByComparingTo("120");
		});
		assertThat(state.stats().itemsPurchased()).isEqualTo(1);
		assertThat(state.stats().totalInvested()).isEqualByComparingTo("120");
	}

	@Test
	void storeFailureDoesNotAbortBatch() {
		lenient().doThrow(new RecordStoreException("disk full", null))
				.when(store).put(eq(StoreCollection.INVENTORY), eq("b"), any());
		AllocationState state = new AllocationState();

		ExecutionResult result = executor.execute(List.of(
				undervalued("a", "10", "90", "100"),
				undervalued("b", "20", "80", "100"),
				undervalued("c", "30", "70", "100")), state);

		assertThat(result.outcomes()).extracting(ItemOutcome::success).containsExactly(true, false, true);
		assertThat(result.failures()).isEqualTo(1);
		assertThat(result.outcomes().get(1).error()).isEqualTo("disk full");
		verify(store, never()).put(eq(StoreCollection.TRANSACTIONS), eq("buy_b_" + NOW.getEpochSecond()), any());
		assertThat(state.stats().itemsPurchased()).isEqualTo(3);
		assertThat(result.invested()).isEqualByComparingTo("60");
	}

	@Test
	void relistUpdatesStoredInventoryAndWritesResaleRecord() {
		EvaluatedListing item = undervalued("a", "100", "90", "180");
		InventoryRecord stored = new InventoryRecord(item.listing(), item.evaluation(), InventoryStatus.PURCHASED,
				null, null, null);
		when(store.get(StoreCollection.INVENTORY, "a", InventoryRecord.class)).thenReturn(Optional.of(stored));
		AllocationState state = new AllocationState();

		RelistResult result = executor.relist(List.of(item), state);
		RelistResult again = executor.relist(List.of(item), state);

		assertThat(result.outcomes()).containsExactly(ItemOutcome.ok("a", "resale_a"));
		assertThat(result.revenueAdded()).isEqualByComparingTo("180");
		assertThat(again.listed()).isEmpty();

		ArgumentCaptor<Object> resale = ArgumentCaptor.forClass(Object.class);
		verify(store).put(eq(StoreCollection.LISTINGS), eq("resale_a"), resale.capture());
		assertThat(resale.getValue()).isInstanceOfSatisfying(InventoryRecord.class, record -> {
			assertThat(record.status()).isEqualTo(InventoryStatus.LISTED);
			assertThat(record.resalePrice()).isEqualByComparingTo(new BigDecimal("180"));
		});
		verify(store).put(eq(StoreCollection.INVENTORY), eq("a"), any());
	}

	@Test
	void relistReportsStoreFailurePerItem() {
		when(store.get(any(), any(), eq(InventoryRecord.class))).thenThrow(new RecordStoreException("offline", null));
		AllocationState state = new AllocationState();

		RelistResult result = executor.relist(List.of(undervalued("a", "100", "90", "180")), state);

		assertThat(result.failures()).isEqualTo(1);
		assertThat(state.isListed("a")).isTrue();
	}
}
