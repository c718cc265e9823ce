package my.marketflipper.app.service;

import my.marketflipper.app.dto.AgentStatusDto;
import my.marketflipper.app.model.InventoryRecord;
import my.marketflipper.app.model.InventoryStatus;
import my.marketflipper.app.model.TransactionRecord;
import my.marketflipper.app.model.TransactionType;
import my.marketflipper.app.store.RecordStore;
import my.marketflipper.app.store.RecordStoreException;
import my.marketflipper.app.store.StoreCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Portfolio view derived from stored records rather than from the in-memory cycle state,
 * so it survives restarts. Unreadable records are skipped and counted.
 */
@Service
public class AgentStatusService {
	private static final Logger logger = LoggerFactory.getLogger(AgentStatusService.class);
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private final RecordStore store;
	private final FlipperAgentService agentService;
	private final AgentConfigService configService;

	public AgentStatusService(RecordStore store, FlipperAgentService agentService, AgentConfigService configService) {
		this.store = store;
		this.agentService = agentService;
		this.configService = configService;
	}

	public AgentStatusDto status() {
		Loaded<InventoryRecord> inventory = load(StoreCollection.INVENTORY, InventoryRecord.class);
		Loaded<TransactionRecord> transactions = load(StoreCollection.TRANSACTIONS, TransactionRecord.class);

		int listed = 0;
		BigDecimal revenue = BigDecimal.ZERO;
		for (InventoryRecord record : inventory.records()) {
			if (record.status() == InventoryStatus.LISTED) {
				listed++;
			}
			revenue = revenue.add(expectedRevenue(record));
		}
		BigDecimal invested = BigDecimal.ZERO;
		for (TransactionRecord transaction : transactions.records()) {
			if (transaction.type() == TransactionType.PURCHASE && transaction.amount() != null) {
				invested = invested.add(transaction.amount());
			}
		}
		BigDecimal profit = revenue.subtract(invested);
		BigDecimal roi = invested.signum() > 0
				? profit.multiply(ONE_HUNDRED).divide(invested, 2, RoundingMode.HALF_UP)
				: BigDecimal.ZERO;
		return new AgentStatusDto(
				inventory.records().size(),
				listed,
				invested,
				revenue,
				profit,
				roi,
				inventory.unreadable() + transactions.unreadable(),
				agentService.sourceNames(),
				agentService.stats(),
				configService.get());
	}

	public List<InventoryRecord> inventory() {
		return load(StoreCollection.INVENTORY, InventoryRecord.class).records();
	}

	public List<TransactionRecord> transactions() {
		return load(StoreCollection.TRANSACTIONS, TransactionRecord.class).records();
	}

	private static BigDecimal expectedRevenue(InventoryRecord record) {
		if (record.resalePrice() != null) {
			return record.resalePrice();
		}
		if (record.evaluation() != null && record.evaluation().estimatedResale() != null) {
			return record.evaluation().estimatedResale();
		}
		return BigDecimal.ZERO;
	}

	private <T> Loaded<T> load(StoreCollection collection, Class<T> type) {
		List<T> records = new ArrayList<>();
		int unreadable = 0;
		for (String key : store.listKeys(collection)) {
			try {
				Optional<T> record = store.get(collection, key, type);
				record.ifPresent(records::add);
			} catch (RecordStoreException ex) {
				unreadable++;
				logger.warn("Skipping unreadable {} record {}: {}", collection.bucketName(), key, ex.getMessage());
			}
		}
		return new Loaded<>(List.copyOf(records), unreadable);
	}

	private record Loaded<T>(List<T> records, int unreadable) {
	}
}
