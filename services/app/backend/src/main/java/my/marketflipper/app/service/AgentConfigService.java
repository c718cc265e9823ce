package my.marketflipper.app.service;

import my.marketflipper.app.config.AppProperties;
import my.marketflipper.app.dto.AgentConfigDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime budget and per-marketplace limit. Starts from {@code app.agent.*}; updates are not persisted.
 */
@Service
public class AgentConfigService {
	private static final Logger logger = LoggerFactory.getLogger(AgentConfigService.class);
	static final BigDecimal DEFAULT_BUDGET = new BigDecimal("5000");
	static final int DEFAULT_MAX_PER_MARKETPLACE = 20;
	static final int MAX_PER_MARKETPLACE_LIMIT = 100;

	private final AtomicReference<AgentConfigDto> current;

	public AgentConfigService(AppProperties properties) {
		AppProperties.Agent agent = properties == null ? null : properties.agent();
		BigDecimal budget = agent == null || agent.budget() == null ? DEFAULT_BUDGET : agent.budget();
		Integer maxPerMarketplace = agent == null || agent.maxPerMarketplace() == null
				? DEFAULT_MAX_PER_MARKETPLACE
				: agent.maxPerMarketplace();
		this.current = new AtomicReference<>(validated(new AgentConfigDto(budget, maxPerMarketplace)));
	}

	public AgentConfigDto get() {
		return current.get();
	}

	public AgentConfigDto update(AgentConfigDto update) {
		AgentConfigDto next = validated(update);
		current.set(next);
		logger.info("Agent config updated (budget={}, maxPerMarketplace={})", next.budget(), next.maxPerMarketplace());
		return next;
	}

	private static AgentConfigDto validated(AgentConfigDto config) {
		if (config == null) {
			throw new IllegalArgumentException("Agent config is required");
		}
		if (config.budget() == null || config.budget().signum() <= 0) {
			throw new IllegalArgumentException("budget must be greater than 0");
		}
		Integer max = config.maxPerMarketplace();
		if (max == null || max < 1 || max > MAX_PER_MARKETPLACE_LIMIT) {
			throw new IllegalArgumentException("max_per_marketplace must be between 1 and " + MAX_PER_MARKETPLACE_LIMIT);
		}
		return config;
	}
}
