package my.marketflipper.app.model;

import java.math.BigDecimal;

public record AgentStats(int listingsScanned,
						 int itemsPurchased,
						 int itemsListed,
						 BigDecimal totalInvested,
						 BigDecimal potentialRevenue,
						 BigDecimal expectedProfit,
						 BigDecimal expectedRoi) {
}
