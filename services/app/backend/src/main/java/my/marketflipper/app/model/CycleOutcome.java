package my.marketflipper.app.model;

public enum CycleOutcome {
	COMPLETED,
	NO_LISTINGS,
	NO_PURCHASES
}
