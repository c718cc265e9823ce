package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CycleRunRequestDto(
		@JsonProperty("budget") @PositiveOrZero BigDecimal budget,
		@JsonProperty("max_per_marketplace") @Min(1) @Max(100) Integer maxPerMarketplace
) {
}
