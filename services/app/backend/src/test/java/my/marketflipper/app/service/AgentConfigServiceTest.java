package my.marketflipper.app.service;

import my.marketflipper.app.config.AppProperties;
import my.marketflipper.app.dto.AgentConfigDto;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentConfigServiceTest {
	@Test
	void startsFromPropertiesOrDefaults() {
		AgentConfigService configured = new AgentConfigService(properties(new AppProperties.Agent(
				new BigDecimal("750"), 7, true, false, 600)));
		AgentConfigService defaults = new AgentConfigService(properties(null));

		assertThat(configured.get()).isEqualTo(new AgentConfigDto(new BigDecimal("750"), 7));
		assertThat(defaults.get().budget()).isEqualByComparingTo("5000");
		assertThat(defaults.get().maxPerMarketplace()).isEqualTo(20);
	}

	@Test
	void updateReplacesRuntimeConfig() {
		AgentConfigService service = new AgentConfigService(properties(null));

		service.update(new AgentConfigDto(new BigDecimal("99.50"), 100));

		assertThat(service.get().budget()).isEqualByComparingTo("99.50");
		assertThat(service.get().maxPerMarketplace()).isEqualTo(100);
	}

	@Test
	void rejectsOutOfRangeValues() {
		AgentConfigService service = new AgentConfigService(properties(null));

		assertThatThrownBy(() -> service.update(new AgentConfigDto(BigDecimal.ZERO, 5)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.update(new AgentConfigDto(BigDecimal.TEN, 101)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.update(new AgentConfigDto(BigDecimal.TEN, 0)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(service.get().budget()).isEqualByComparingTo("5000");
	}

	private static AppProperties properties(AppProperties.Agent agent) {
		return new AppProperties(new AppProperties.Security("admin", "admin"), agent, null, null);
	}
}
