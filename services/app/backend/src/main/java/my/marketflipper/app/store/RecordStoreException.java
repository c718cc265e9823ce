package my.marketflipper.app.store;

public class RecordStoreException extends RuntimeException {
	public RecordStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
