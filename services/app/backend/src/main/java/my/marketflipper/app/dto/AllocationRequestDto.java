package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.marketflipper.app.model.Listing;

import java.math.BigDecimal;
import java.util.List;

public record AllocationRequestDto(
		@JsonProperty("budget") @NotNull @PositiveOrZero BigDecimal budget,
		@JsonProperty("listings") @NotNull List<Listing> listings
) {
}
