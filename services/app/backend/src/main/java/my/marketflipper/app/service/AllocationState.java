package my.marketflipper.app.service;

import my.marketflipper.app.model.AgentStats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable allocation context of one agent. Purchased and listed ids only ever grow.
 * One writer per instance; readers such as the status endpoint may call from other threads.
 */
public class AllocationState {
	private final Set<String> purchasedIds = new LinkedHashSet<>();
	private final Set<String> listedIds = new LinkedHashSet<>();
	private BigDecimal remainingBudget = BigDecimal.ZERO;

	private int listingsScanned;
	private int itemsPurchased;
	private int itemsListed;
	private BigDecimal totalInvested = BigDecimal.ZERO;
	private BigDecimal potentialRevenue = BigDecimal.ZERO;

	public static AllocationState restored(Collection<String> purchased, Collection<String> listed) {
		AllocationState state = new AllocationState();
		if (purchased != null) {
			state.purchasedIds.addAll(purchased);
		}
		if (listed != null) {
			state.listedIds.addAll(listed);
		}
		return state;
	}

	public synchronized boolean hasPurchased(String id) {
		return purchasedIds.contains(id);
	}

	public synchronized boolean isListed(String id) {
		return listedIds.contains(id);
	}

	public synchronized Set<String> purchasedIds() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(purchasedIds));
	}

	public synchronized Set<String> listedIds() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(listedIds));
	}

	public synchronized BigDecimal remainingBudget() {
		return remainingBudget;
	}

	synchronized void startPass(BigDecimal budget) {
		this.remainingBudget = budget;
	}

	synchronized void accept(String id, BigDecimal price) {
		purchasedIds.add(id);
		remainingBudget = remainingBudget.subtract(price);
	}

	synchronized void markListed(String id, BigDecimal resalePrice) {
		if (listedIds.add(id)) {
			itemsListed += 1;
			potentialRevenue = potentialRevenue.add(resalePrice);
		}
	}

	synchronized void recordPurchase(BigDecimal price) {
		itemsPurchased += 1;
		totalInvested = totalInvested.add(price);
	}

	synchronized void recordScanned(int count) {
		listingsScanned = count;
	}

	public synchronized AgentStats stats() {
		BigDecimal profit = potentialRevenue.subtract(totalInvested);
		BigDecimal roi = totalInvested.signum() > 0
				? profit.multiply(new BigDecimal("100")).divide(totalInvested, 2, RoundingMode.HALF_UP)
				: BigDecimal.ZERO;
		return new AgentStats(listingsScanned, itemsPurchased, itemsListed,
				totalInvested, potentialRevenue, profit, roi);
	}
}
