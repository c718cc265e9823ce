package my.marketflipper.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Security security,
		Agent agent,
		Valuation valuation,
		Sources sources
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Agent(
			BigDecimal budget,
			Integer maxPerMarketplace,
			Boolean restoreState,
			Boolean schedulerEnabled,
			Integer pollIntervalSeconds
	) {
	}

	public record Valuation(
			String referencesResource,
			BigDecimal minScore,
			BigDecimal minProfitMargin,
			BigDecimal minProfit
	) {
	}

	public record Sources(
			Craigslist craigslist,
			Ebay ebay,
			Sample sample,
			Integer timeoutSeconds
	) {
		public record Craigslist(
				boolean enabled,
				String city,
				String category,
				String baseUrl
		) {
		}

		public record Ebay(
				boolean enabled,
				String category,
				String baseUrl
		) {
		}

		public record Sample(
				boolean enabled,
				String location,
				String category,
				Long seed
		) {
		}
	}
}
