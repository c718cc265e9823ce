package my.marketflipper.app.service;

/**
 * Raised when the allocator is handed structurally broken input. Business-level skips never raise.
 */
public class AllocationInputException extends IllegalArgumentException {
	public AllocationInputException(String message) {
		super(message);
	}
}
