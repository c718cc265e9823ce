package my.marketflipper.app.store;

public enum StoreCollection {
	LISTINGS("flipper-listings"),
	TRANSACTIONS("flipper-transactions"),
	INVENTORY("flipper-inventory");

	private final String bucketName;

	StoreCollection(String bucketName) {
		this.bucketName = bucketName;
	}

	public String bucketName() {
		return bucketName;
	}
}
