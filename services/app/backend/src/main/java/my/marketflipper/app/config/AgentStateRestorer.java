package my.marketflipper.app.config;

import my.marketflipper.app.service.FlipperAgentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class AgentStateRestorer implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(AgentStateRestorer.class);

	private final FlipperAgentService agentService;
	private final AppProperties properties;

	public AgentStateRestorer(FlipperAgentService agentService, AppProperties properties) {
		this.agentService = agentService;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		AppProperties.Agent agent = properties.agent();
		if (agent != null && Boolean.FALSE.equals(agent.restoreState())) {
			logger.info("Agent state restore disabled (app.agent.restore-state=false)");
			return;
		}
		agentService.restoreState();
	}
}
