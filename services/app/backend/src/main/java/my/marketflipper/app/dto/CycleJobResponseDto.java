package my.marketflipper.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.marketflipper.app.model.CycleReport;

public record CycleJobResponseDto(
		@JsonProperty("job_id") String jobId,
		@JsonProperty("status") CycleJobStatus status,
		@JsonProperty("report") CycleReport report,
		@JsonProperty("error") String error
) {
}
