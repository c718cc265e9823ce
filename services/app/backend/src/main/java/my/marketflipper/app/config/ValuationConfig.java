package my.marketflipper.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.marketflipper.app.model.HistoricalReferenceTable;
import my.marketflipper.app.model.ValuationThresholds;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
public class ValuationConfig {
	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public HistoricalReferenceTable historicalReferenceTable(AppProperties properties,
															 ResourceLoader resourceLoader,
															 ObjectMapper objectMapper) {
		String location = properties.valuation() == null ? null : properties.valuation().referencesResource();
		return new HistoricalReferenceLoader(resourceLoader, objectMapper).load(location);
	}

	@Bean
	public ValuationThresholds valuationThresholds(AppProperties properties) {
		AppProperties.Valuation valuation = properties.valuation();
		if (valuation == null) {
			return ValuationThresholds.defaults();
		}
		return ValuationThresholds.of(valuation.minScore(), valuation.minProfitMargin(), valuation.minProfit());
	}
}
