package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.marketflipper.app.model.AgentStats;

import java.math.BigDecimal;
import java.util.List;

public record AgentStatusDto(
		@JsonProperty("items_purchased") int itemsPurchased,
		@JsonProperty("items_listed") int itemsListed,
		@JsonProperty("total_invested") BigDecimal totalInvested,
		@JsonProperty("potential_revenue") BigDecimal potentialRevenue,
		@JsonProperty("expected_profit") BigDecimal expectedProfit,
		@JsonProperty("roi_percent") BigDecimal roiPercent,
		@JsonProperty("unreadable_records") int unreadableRecords,
		@JsonProperty("sources") List<String> sources,
		@JsonProperty("session") AgentStats session,
		@JsonProperty("config") AgentConfigDto config
) {
}
