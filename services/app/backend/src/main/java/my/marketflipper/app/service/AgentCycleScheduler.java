package my.marketflipper.app.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import my.marketflipper.app.config.AppProperties;
import my.marketflipper.app.dto.AgentConfigDto;
import my.marketflipper.app.model.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
@ConditionalOnProperty(name = "app.agent.scheduler-enabled", havingValue = "true")
public class AgentCycleScheduler {
	private static final Logger logger = LoggerFactory.getLogger(AgentCycleScheduler.class);
	private static final long DEFAULT_POLL_INTERVAL_SECONDS = 3600;
	private static final long RETRY_DELAY_SECONDS = 60;

	private final FlipperAgentService agentService;
	private final AgentConfigService configService;
	private final long pollIntervalSeconds;
	private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

	public AgentCycleScheduler(FlipperAgentService agentService,
							   AgentConfigService configService,
							   AppProperties properties) {
		this.agentService = agentService;
		this.configService = configService;
		Integer interval = properties.agent() == null ? null : properties.agent().pollIntervalSeconds();
		this.pollIntervalSeconds = interval == null ? DEFAULT_POLL_INTERVAL_SECONDS : Math.max(60, interval);
	}

	@PostConstruct
	public void schedule() {
		logger.info("Agent cycle scheduler enabled (interval={}s)", pollIntervalSeconds);
		scheduleNext(5);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void scheduleNext(long delaySeconds) {
		executor.schedule(this::runOnce, Math.max(1, delaySeconds), TimeUnit.SECONDS);
	}

	private void runOnce() {
		try {
			AgentConfigDto config = configService.get();
			CycleReport report = agentService.runCycle(config.budget(), config.maxPerMarketplace());
			logger.info("Scheduled cycle finished: {}", report.outcome());
			scheduleNext(pollIntervalSeconds);
		} catch (Exception ex) {
			logger.warn("Scheduled cycle failed: {}", ex.getMessage());
			scheduleNext(RETRY_DELAY_SECONDS);
		}
	}
}
