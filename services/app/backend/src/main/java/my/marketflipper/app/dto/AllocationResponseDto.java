package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.marketflipper.app.model.AllocationResult;
import my.marketflipper.app.model.EvaluatedListing;

import java.util.List;

public record AllocationResponseDto(
		@JsonProperty("ranked") List<EvaluatedListing> ranked,
		@JsonProperty("allocation") AllocationResult allocation
) {
}
