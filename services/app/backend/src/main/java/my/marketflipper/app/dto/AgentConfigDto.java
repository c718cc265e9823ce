package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record AgentConfigDto(
		@JsonProperty("budget") @NotNull @Positive BigDecimal budget,
		@JsonProperty("max_per_marketplace") @NotNull @Min(1) @Max(100) Integer maxPerMarketplace
) {
}
