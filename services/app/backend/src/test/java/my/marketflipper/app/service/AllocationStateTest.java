package my.marketflipper.app.service;

import my.marketflipper.app.model.AgentStats;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationStateTest {
	private static final BigDecimal PRICE = new BigDecimal("25");
	private static final BigDecimal RESALE = new BigDecimal("40");

	@Test
	void statsSnapshotsStayConsistentWhileCycleWrites() throws Exception {
		AllocationState state = new AllocationState();
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<?> writer = executor.submit(() -> {
				for (int i = 0; i < 5_000; i++) {
					state.recordPurchase(PRICE);
					state.markListed("item-" + i, RESALE);
				}
			});
			while (!writer.isDone()) {
				assertConsistent(state.stats());
			}
			writer.get(10, TimeUnit.SECONDS);

			AgentStats last = state.stats();
			assertConsistent(last);
			assertThat(last.itemsPurchased()).isEqualTo(5_000);
			assertThat(last.itemsListed()).isEqualTo(5_000);
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void idViewsAreSnapshots() {
		AllocationState state = AllocationState.restored(List.of("a"), List.of());
		Set<String> purchased = state.purchasedIds();

		state.accept("b", BigDecimal.ONE);

		assertThat(purchased).containsExactly("a");
		assertThat(state.purchasedIds()).containsExactly("a", "b");
	}

	private static void assertConsistent(AgentStats stats) {
		assertThat(stats.totalInvested())
				.isEqualByComparingTo(PRICE.multiply(BigDecimal.valueOf(stats.itemsPurchased())));
		assertThat(stats.potentialRevenue())
				.isEqualByComparingTo(RESALE.multiply(BigDecimal.valueOf(stats.itemsListed())));
	}
}
