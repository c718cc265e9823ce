package my.marketflipper.app.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one scan, evaluate, allocate, execute and relist pass.
 * Stages after an early exit are {@code null}.
 */
public record CycleReport(CycleOutcome outcome,
						  String message,
						  BigDecimal budget,
						  int maxPerMarketplace,
						  List<SourceReport> sources,
						  int listingsScanned,
						  int undervaluedCount,
						  AllocationResult allocation,
						  ExecutionResult execution,
						  RelistResult relist,
						  AgentStats stats,
						  LocalDateTime startedAt,
						  LocalDateTime finishedAt) {
}
