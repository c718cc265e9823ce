package my.marketflipper.app.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.marketflipper.app.domain.StoreRecord;
import my.marketflipper.app.domain.StoreRecordId;
import my.marketflipper.app.repository.StoreRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class JpaRecordStore implements RecordStore {
	private static final Logger logger = LoggerFactory.getLogger(JpaRecordStore.class);

	private final StoreRecordRepository repository;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public JpaRecordStore(StoreRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
		this.repository = repository;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	@Transactional
	public void put(StoreCollection collection, String key, Object record) {
		requireKey(collection, key);
		String payload;
		try {
			payload = objectMapper.writeValueAsString(record);
		} catch (JsonProcessingException ex) {
			throw new RecordStoreException("Failed to serialize record " + describe(collection, key), ex);
		}
		try {
			StoreRecord entity = repository.findById(new StoreRecordId(collection.bucketName(), key))
					.orElseGet(StoreRecord::new);
			entity.setBucket(collection.bucketName());
			entity.setRecordKey(key);
			entity.setPayload(payload);
			entity.setUpdatedAt(LocalDateTime.now(clock));
			repository.save(entity);
		} catch (DataAccessException ex) {
			throw new RecordStoreException("Failed to store record " + describe(collection, key), ex);
		}
		logger.debug("Stored record {}", describe(collection, key));
	}

	@Override
	@Transactional(readOnly = true)
	public <T> Optional<T> get(StoreCollection collection, String key, Class<T> type) {
		requireKey(collection, key);
		Optional<StoreRecord> entity;
		try {
			entity = repository.findById(new StoreRecordId(collection.bucketName(), key));
		} catch (DataAccessException ex) {
			throw new RecordStoreException("Failed to load record " + describe(collection, key), ex);
		}
		if (entity.isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(entity.get().getPayload(), type));
		} catch (JsonProcessingException ex) {
			throw new RecordStoreException("Failed to parse record " + describe(collection, key), ex);
		}
	}

	@Override
	@Transactional(readOnly = true)
	public List<String> listKeys(StoreCollection collection) {
		if (collection == null) {
			throw new IllegalArgumentException("Collection is required");
		}
		try {
			return repository.findKeysByBucket(collection.bucketName());
		} catch (DataAccessException ex) {
			throw new RecordStoreException("Failed to list keys of " + collection.bucketName(), ex);
		}
	}

	@Override
	@Transactional
	public boolean delete(StoreCollection collection, String key) {
		requireKey(collection, key);
		StoreRecordId id = new StoreRecordId(collection.bucketName(), key);
		try {
			if (!repository.existsById(id)) {
				return false;
			}
			repository.deleteById(id);
			return true;
		} catch (DataAccessException ex) {
			throw new RecordStoreException("Failed to delete record " + describe(collection, key), ex);
		}
	}

	private void requireKey(StoreCollection collection, String key) {
		if (collection == null) {
			throw new IllegalArgumentException("Collection is required");
		}
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("Record key is required");
		}
	}

	private String describe(StoreCollection collection, String key) {
		return collection.bucketName() + "/" + key;
	}
}
