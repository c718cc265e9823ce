package my.marketflipper.app.store;

import java.util.List;
import java.util.Optional;

/**
 * Keyed record storage split into named collections. Records are opaque to the store.
 * Implementations signal failures with {@link RecordStoreException}.
 */
public interface RecordStore {
	void put(StoreCollection collection, String key, Object record);

	<T> Optional<T> get(StoreCollection collection, String key, Class<T> type);

	List<String> listKeys(StoreCollection collection);

	boolean delete(StoreCollection collection, String key);
}
