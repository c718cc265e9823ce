package my.marketflipper.app.model;

public enum DecisionAction {
	BUY,
	SKIP
}
