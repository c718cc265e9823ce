package my.marketflipper.app.model;

public enum SkipReason {
	ALREADY_PURCHASED,
	NOT_UNDERVALUED,
	EXCEEDS_BUDGET
}
