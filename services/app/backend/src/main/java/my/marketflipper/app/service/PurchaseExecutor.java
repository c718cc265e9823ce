package my.marketflipper.app.service;

import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.ExecutionResult;
import my.marketflipper.app.model.InventoryRecord;
import my.marketflipper.app.model.InventoryStatus;
import my.marketflipper.app.model.ItemOutcome;
import my.marketflipper.app.model.RelistPlan;
import my.marketflipper.app.model.RelistResult;
import my.marketflipper.app.model.TransactionRecord;
import my.marketflipper.app.model.TransactionType;
import my.marketflipper.app.store.RecordStore;
import my.marketflipper.app.store.RecordStoreException;
import my.marketflipper.app.store.StoreCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the inventory, transaction and relist records for allocator output.
 * Every item is attempted; a failed write is reported in its {@link ItemOutcome}.
 */
@Service
public class PurchaseExecutor {
	private static final Logger logger = LoggerFactory.getLogger(PurchaseExecutor.class);
	static final String RESALE_PREFIX = "resale_";
	static final String PURCHASE_PREFIX = "buy_";

	private final RecordStore store;
	private final AllocationEngine allocationEngine;
	private final Clock clock;

	public PurchaseExecutor(RecordStore store, AllocationEngine allocationEngine, Clock clock) {
		this.store = store;
		this.allocationEngine = allocationEngine;
		this.clock = clock;
	}

	public ExecutionResult execute(List<EvaluatedListing> purchases, AllocationState state) {
		if (purchases == null || purchases.isEmpty()) {
			return new ExecutionResult(List.of(), BigDecimal.ZERO);
		}
		List<ItemOutcome> outcomes = new ArrayList<>();
		BigDecimal invested = BigDecimal.ZERO;
		for (EvaluatedListing item : purchases) {
			Instant now = clock.instant();
			LocalDateTime purchasedAt = LocalDateTime.now(clock);
			String transactionKey = PURCHASE_PREFIX + item.id() + "_" + now.getEpochSecond();
			InventoryRecord inventory = new InventoryRecord(item.listing(), item.evaluation(),
					InventoryStatus.PURCHASED, purchasedAt, null, null);
			TransactionRecord transaction = new TransactionRecord(TransactionType.PURCHASE, item.id(),
					item.price(), purchasedAt);
			try {
				store.put(StoreCollection.INVENTORY, item.id(), inventory);
				store.put(StoreCollection.TRANSACTIONS, transactionKey, transaction);
				outcomes.add(ItemOutcome.ok(item.id(), transactionKey));
				logger.info("Purchased {} for {}", item.id(), item.price());
			} catch (RecordStoreException ex) {
				logger.warn("Purchase of {} not recorded: {}", item.id(), ex.getMessage());
				outcomes.add(ItemOutcome.failed(item.id(), transactionKey, ex.getMessage()));
			}
			state.recordPurchase(item.price());
			invested = invested.add(item.price());
		}
		return new ExecutionResult(List.copyOf(outcomes), invested);
	}

	public RelistResult relist(List<EvaluatedListing> purchases, AllocationState state) {
		RelistPlan plan = allocationEngine.planRelist(purchases, state);
		List<ItemOutcome> outcomes = new ArrayList<>();
		for (RelistPlan.Entry entry : plan.entries()) {
			EvaluatedListing item = entry.item();
			String key = RESALE_PREFIX + item.id();
			LocalDateTime listedAt = LocalDateTime.now(clock);
			try {
				InventoryRecord listed = store.get(StoreCollection.INVENTORY, item.id(), InventoryRecord.class)
						.orElseGet(() -> new InventoryRecord(item.listing(), item.evaluation(),
								InventoryStatus.PURCHASED, listedAt, null, null))
						.listed(entry.resalePrice(), listedAt);
				store.put(StoreCollection.LISTINGS, key, listed);
				store.put(StoreCollection.INVENTORY, item.id(), listed);
				outcomes.add(ItemOutcome.ok(item.id(), key));
				logger.info("Listed {} at {} (markup {})", item.id(), entry.resalePrice(),
						entry.resalePrice().subtract(item.price()));
			} catch (RecordStoreException ex) {
				logger.warn("Relisting of {} not recorded: {}", item.id(), ex.getMessage());
				outcomes.add(ItemOutcome.failed(item.id(), key, ex.getMessage()));
			}
		}
		return new RelistResult(plan.entries(), List.copyOf(outcomes), plan.revenueAdded());
	}
}
