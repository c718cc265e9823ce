package my.marketflipper.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.marketflipper.app.dto.AgentConfigDto;
import my.marketflipper.app.dto.AgentStatusDto;
import my.marketflipper.app.dto.AllocationRequestDto;
import my.marketflipper.app.dto.AllocationResponseDto;
import my.marketflipper.app.dto.CycleJobResponseDto;
import my.marketflipper.app.dto.CycleRunRequestDto;
import my.marketflipper.app.model.AllocationResult;
import my.marketflipper.app.model.EvaluatedListing;
import my.marketflipper.app.model.HistoricalReference;
import my.marketflipper.app.model.InventoryRecord;
import my.marketflipper.app.model.Listing;
import my.marketflipper.app.model.TransactionRecord;
import my.marketflipper.app.service.AgentConfigService;
import my.marketflipper.app.service.AgentStatusService;
import my.marketflipper.app.service.AllocationEngine;
import my.marketflipper.app.service.AllocationState;
import my.marketflipper.app.service.CycleJobService;
import my.marketflipper.app.service.ValuationModel;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/agent")
@Tag(name = "Flipper Agent")
public class AgentController {
	private final CycleJobService cycleJobService;
	private final ValuationModel valuationModel;
	private final AllocationEngine allocationEngine;
	private final AgentStatusService statusService;
	private final AgentConfigService configService;

	public AgentController(CycleJobService cycleJobService,
						   ValuationModel valuationModel,
						   AllocationEngine allocationEngine,
						   AgentStatusService statusService,
						   AgentConfigService configService) {
		this.cycleJobService = cycleJobService;
		this.valuationModel = valuationModel;
		this.allocationEngine = allocationEngine;
		this.statusService = statusService;
		this.configService = configService;
	}

	@PostMapping("/cycles")
	@Operation(summary = "Start a scan, buy and relist cycle")
	public CycleJobResponseDto startCycle(@Valid @RequestBody(required = false) CycleRunRequestDto request) {
		return cycleJobService.start(request);
	}

	@GetMapping("/cycles/{jobId}")
	@Operation(summary = "Get cycle job status")
	public CycleJobResponseDto getCycle(@PathVariable("jobId") String jobId) {
		return cycleJobService.get(jobId);
	}

	@PostMapping("/evaluate")
	@Operation(summary = "Evaluate listings and rank them by score")
	public List<EvaluatedListing> evaluate(@RequestBody List<Listing> listings) {
		if (listings == null) {
			throw new IllegalArgumentException("Listings are required");
		}
		return valuationModel.batchEvaluate(listings);
	}

	@PostMapping("/allocate")
	@Operation(summary = "Dry-run allocation of a budget over listings")
	public AllocationResponseDto allocate(@Valid @RequestBody AllocationRequestDto request) {
		List<EvaluatedListing> ranked = valuationModel.batchEvaluate(request.listings());
		AllocationResult allocation = allocationEngine.allocate(ranked, request.budget(), new AllocationState());
		return new AllocationResponseDto(ranked, allocation);
	}

	@GetMapping("/status")
	@Operation(summary = "Get portfolio status from stored records")
	public AgentStatusDto status() {
		return statusService.status();
	}

	@GetMapping("/inventory")
	@Operation(summary = "List inventory records")
	public List<InventoryRecord> inventory() {
		return statusService.inventory();
	}

	@GetMapping("/transactions")
	@Operation(summary = "List transaction records")
	public List<TransactionRecord> transactions() {
		return statusService.transactions();
	}

	@GetMapping("/references")
	@Operation(summary = "List historical price references in match order")
	public List<HistoricalReference> references() {
		return valuationModel.references().entries();
	}

	@GetMapping("/config")
	@Operation(summary = "Get runtime agent config")
	public AgentConfigDto getConfig() {
		return configService.get();
	}

	@PutMapping("/config")
	@Operation(summary = "Update runtime agent config")
	public AgentConfigDto updateConfig(@Valid @RequestBody AgentConfigDto request) {
		return configService.update(request);
	}
}
