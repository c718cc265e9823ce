package my.marketflipper.app.model;

public record ItemOutcome(String itemId, String recordKey, boolean success, String error) {
	public static ItemOutcome ok(String itemId, String recordKey) {
		return new ItemOutcome(itemId, recordKey, true, null);
	}

	public static ItemOutcome failed(String itemId, String recordKey, String error) {
		return new ItemOutcome(itemId, recordKey, false, error);
	}
}
