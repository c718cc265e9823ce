package my.marketflipper.app.service;

import jakarta.annotation.PreDestroy;
import my.marketflipper.app.dto.AgentConfigDto;
import my.marketflipper.app.dto.CycleJobResponseDto;
import my.marketflipper.app.dto.CycleJobStatus;
import my.marketflipper.app.dto.CycleRunRequestDto;
import my.marketflipper.app.model.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Service
public class CycleJobService {
	private static final Logger logger = LoggerFactory.getLogger(CycleJobService.class);
	private static final Duration JOB_TTL = Duration.ofMinutes(30);

	private final FlipperAgentService agentService;
	private final AgentConfigService configService;
	private final Clock clock;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor = Executors.newSingleThreadExecutor();

	public CycleJobService(FlipperAgentService agentService, AgentConfigService configService, Clock clock) {
		this.agentService = agentService;
		this.configService = configService;
		this.clock = clock;
	}

	public CycleJobResponseDto start(CycleRunRequestDto request) {
		cleanupExpired();
		AgentConfigDto config = configService.get();
		BigDecimal budget = request == null || request.budget() == null ? config.budget() : request.budget();
		int maxPerMarketplace = request == null || request.maxPerMarketplace() == null
				? config.maxPerMarketplace()
				: request.maxPerMarketplace();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, budget, maxPerMarketplace, clock.instant());
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		logger.info("Cycle job {} queued (budget={}, maxPerMarketplace={})", jobId, budget, maxPerMarketplace);
		return toDto(job);
	}

	public CycleJobResponseDto get(String jobId) {
		cleanupExpired();
		JobState job = jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Cycle job not found");
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			job.status = CycleJobStatus.RUNNING;
			job.report = agentService.runCycle(job.budget, job.maxPerMarketplace);
			job.status = CycleJobStatus.DONE;
		} catch (Exception ex) {
			job.status = CycleJobStatus.FAILED;
			job.error = failWithReference(job, ex);
		} finally {
			job.finishedAt = clock.instant();
		}
	}

	private CycleJobResponseDto toDto(JobState job) {
		return new CycleJobResponseDto(job.jobId, job.status, job.report, job.error);
	}

	private void cleanupExpired() {
		Instant now = clock.instant();
		jobs.entrySet().removeIf(entry -> {
			JobState job = entry.getValue();
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			return base.plus(JOB_TTL).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String reference = "FC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Cycle job failed (ref={}, jobId={}, budget={}, maxPerMarketplace={}, error={})",
				reference, job.jobId, job.budget, job.maxPerMarketplace, ex.getMessage(), ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String jobId;
		private final BigDecimal budget;
		private final int maxPerMarketplace;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile CycleJobStatus status;
		private volatile CycleReport report;
		private volatile String error;

		private JobState(String jobId, BigDecimal budget, int maxPerMarketplace, Instant createdAt) {
			this.jobId = jobId;
			this.budget = budget;
			this.maxPerMarketplace = maxPerMarketplace;
			this.createdAt = createdAt;
			this.status = CycleJobStatus.PENDING;
		}
	}
}
