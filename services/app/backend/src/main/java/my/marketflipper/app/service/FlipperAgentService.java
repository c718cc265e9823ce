package my.marketflipper.app.service;

import my.marketflipper.app.model.AgentStats;
import my.marketflipper.app.model.AllocationResult;
import my.marketflipper.app.model.CycleOutcome;
import my.marketflipper.app.model.CycleReport;
import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.ExecutionResult;
import my.marketflipper.app.model.Listing;
import my.marketflipper.app.model.RelistResult;
import my.marketflipper.app.model.SourceReport;
import my.marketflipper.app.source.ListingSource;
import my.marketflipper.app.source.ScrapeSkip;
import my.marketflipper.app.source.SourceFetchResult;
import my.marketflipper.app.store.RecordStore;
import my.marketflipper.app.store.RecordStoreException;
import my.marketflipper.app.store.StoreCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the flipping cycle against the configured listing sources.
 * Holds the single {@link AllocationState} of this agent; cycles never overlap.
 */
@Service
public class FlipperAgentService {
	private static final Logger logger = LoggerFactory.getLogger(FlipperAgentService.class);

	private final List<ListingSource> sources;
	private final ValuationModel valuationModel;
	private final AllocationEngine allocationEngine;
	private final PurchaseExecutor purchaseExecutor;
	private final RecordStore store;
	private final Clock clock;
	private final ReentrantLock cycleLock = new ReentrantLock();
	private volatile AllocationState state = new AllocationState();

	@Autowired
	public FlipperAgentService(ObjectProvider<ListingSource> sources,
							   ValuationModel valuationModel,
							   AllocationEngine allocationEngine,
							   PurchaseExecutor purchaseExecutor,
							   RecordStore store,
							   Clock clock) {
		this(sources.orderedStream().toList(), valuationModel, allocationEngine, purchaseExecutor, store, clock);
	}

	FlipperAgentService(List<ListingSource> sources,
						ValuationModel valuationModel,
						AllocationEngine allocationEngine,
						PurchaseExecutor purchaseExecutor,
						RecordStore store,
						Clock clock) {
		this.sources = List.copyOf(sources);
		this.valuationModel = valuationModel;
		this.allocationEngine = allocationEngine;
		this.purchaseExecutor = purchaseExecutor;
		this.store = store;
		this.clock = clock;
	}

	public CycleReport runCycle(BigDecimal budget, int maxPerMarketplace) {
		if (budget == null || budget.signum() < 0) {
			throw new IllegalArgumentException("Budget must be zero or positive");
		}
		if (maxPerMarketplace < 1) {
			throw new IllegalArgumentException("maxPerMarketplace must be at least 1");
		}
		cycleLock.lock();
		try {
			return doRunCycle(budget, maxPerMarketplace);
		} finally {
			cycleLock.unlock();
		}
	}

	/**
	 * Replaces the in-memory state with the ids recorded in the store.
	 * Inventory keys are purchased ids; listings keys with the resale prefix are listed ids.
	 */
	public void restoreState() {
		cycleLock.lock();
		try {
			List<String> purchased = store.listKeys(StoreCollection.INVENTORY);
			List<String> listed = new ArrayList<>();
			for (String key : store.listKeys(StoreCollection.LISTINGS)) {
				if (key.startsWith(PurchaseExecutor.RESALE_PREFIX)) {
					listed.add(key.substring(PurchaseExecutor.RESALE_PREFIX.length()));
				}
			}
			state = AllocationState.restored(purchased, listed);
			logger.info("Restored agent state ({} purchased, {} listed)", purchased.size(), listed.size());
		} catch (RecordStoreException ex) {
			logger.warn("Agent state not restored, starting empty: {}", ex.getMessage());
		} finally {
			cycleLock.unlock();
		}
	}

	public AgentStats stats() {
		return state.stats();
	}

	public List<String> sourceNames() {
		return sources.stream().map(ListingSource::name).toList();
	}

	AllocationState state() {
		return state;
	}

	private CycleReport doRunCycle(BigDecimal budget, int maxPerMarketplace) {
		LocalDateTime startedAt = LocalDateTime.now(clock);
		AllocationState current = state;
		logger.info("Starting flipping cycle (budget={}, maxPerMarketplace={}, sources={})",
				budget, maxPerMarketplace, sourceNames());

		List<SourceReport> sourceReports = new ArrayList<>();
		List<Listing> listings = scan(maxPerMarketplace, sourceReports);
		current.recordScanned(listings.size());
		if (listings.isEmpty()) {
			logger.info("No listings found, cycle ends early");
			return new CycleReport(CycleOutcome.NO_LISTINGS, "No listings found", budget, maxPerMarketplace,
					List.copyOf(sourceReports), 0, 0, null, null, null, current.stats(),
					startedAt, LocalDateTime.now(clock));
		}

		List<EvaluatedListing> ranked = valuationModel.batchEvaluate(listings);
		int undervalued = (int) ranked.stream().filter(EvaluatedListing::undervalued).count();
		logger.info("Evaluated {} listings, {} undervalued", ranked.size(), undervalued);

		AllocationResult allocation = allocationEngine.allocate(ranked, budget, current);
		if (allocation.purchases().isEmpty()) {
			logger.info("No items selected for purchase");
			logStats(current.stats());
			return new CycleReport(CycleOutcome.NO_PURCHASES, "No items selected for purchase", budget,
					maxPerMarketplace, List.copyOf(sourceReports), listings.size(), undervalued, allocation,
					null, null, current.stats(), startedAt, LocalDateTime.now(clock));
		}

		ExecutionResult execution = purchaseExecutor.execute(allocation.purchases(), current);
		RelistResult relist = purchaseExecutor.relist(allocation.purchases(), current);
		AgentStats stats = current.stats();
		logStats(stats);
		if (execution.failures() > 0 || relist.failures() > 0) {
			logger.warn("Cycle finished with {} purchase and {} relist record failures",
					execution.failures(), relist.failures());
		}
		return new CycleReport(CycleOutcome.COMPLETED, "Cycle completed", budget, maxPerMarketplace,
				List.copyOf(sourceReports), listings.size(), undervalued, allocation, execution, relist,
				stats, startedAt, LocalDateTime.now(clock));
	}

	private List<Listing> scan(int maxPerMarketplace, List<SourceReport> reports) {
		List<Listing> all = new ArrayList<>();
		for (ListingSource source : sources) {
			SourceFetchResult result;
			try {
				result = source.fetch(maxPerMarketplace);
			} catch (RuntimeException ex) {
				logger.warn("Listing source {} failed: {}", source.name(), ex.getMessage());
				reports.add(SourceReport.failed(source.name(), ex.getMessage()));
				continue;
			}
			List<ScrapeSkip> skipped = new ArrayList<>(result.skipped());
			List<Listing> fetched = result.listings();
			int accepted = 0;
			int stored = 0;
			for (int idx = 0; idx < fetched.size(); idx++) {
				Optional<String> problem = validate(fetched.get(idx));
				if (problem.isPresent()) {
					skipped.add(new ScrapeSkip(idx, problem.get()));
					continue;
				}
				Listing listing = normalize(fetched.get(idx));
				accepted++;
				all.add(listing);
				if (storeListing(listing)) {
					stored++;
				}
			}
			logger.info("Found {} listings from {} ({} stored, {} skipped)",
					accepted, source.name(), stored, skipped.size());
			reports.add(new SourceReport(source.name(), fetched.size(), accepted, stored, List.copyOf(skipped), null));
		}
		logger.info("Total listings scanned: {}", all.size());
		return all;
	}

	private boolean storeListing(Listing listing) {
		try {
			store.put(StoreCollection.LISTINGS, listing.id(), listing);
			return true;
		} catch (RecordStoreException ex) {
			logger.warn("Listing {} not stored: {}", listing.id(), ex.getMessage());
			return false;
		}
	}

	static Optional<String> validate(Listing listing) {
		if (listing == null) {
			return Optional.of("Listing is null");
		}
		if (listing.id() == null || listing.id().isBlank()) {
			return Optional.of("Missing id");
		}
		if (listing.title() == null || listing.title().isBlank()) {
			return Optional.of("Missing title");
		}
		if (listing.marketplace() == null || listing.marketplace().isBlank()) {
			return Optional.of("Missing marketplace");
		}
		return Optional.empty();
	}

	static Listing normalize(Listing listing) {
		return new Listing(
				listing.id().trim(),
				listing.title().trim(),
				listing.price(),
				listing.url(),
				listing.marketplace(),
				listing.category(),
				listing.timestamp());
	}

	private static void logStats(AgentStats stats) {
		logger.info("Agent stats: scanned={}, purchased={}, listed={}, invested={}, potentialRevenue={}, "
						+ "expectedProfit={}, roi={}%",
				stats.listingsScanned(), stats.itemsPurchased(), stats.itemsListed(), stats.totalInvested(),
				stats.potentialRevenue(), stats.expectedProfit(), stats.expectedRoi());
	}
}
