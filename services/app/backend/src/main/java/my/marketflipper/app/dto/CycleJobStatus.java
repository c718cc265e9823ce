package my.marketflipper.app.dto;

public enum CycleJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED
}
