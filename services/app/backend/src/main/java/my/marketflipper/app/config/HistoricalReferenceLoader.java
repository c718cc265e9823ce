package my.marketflipper.app.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.marketflipper.app.model.HistoricalReference;
import my.marketflipper.app.model.HistoricalReferenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the reference table from a JSON array resource. Array order is match order.
 */
public class HistoricalReferenceLoader {
	private static final Logger logger = LoggerFactory.getLogger(HistoricalReferenceLoader.class);
	public static final String DEFAULT_RESOURCE = "classpath:historical_references.json";

	private final ResourceLoader resourceLoader;
	private final ObjectMapper objectMapper;

	public HistoricalReferenceLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
		this.resourceLoader = resourceLoader;
		this.objectMapper = objectMapper;
	}

	public HistoricalReferenceTable load(String location) {
		String resolved = location == null || location.isBlank() ? DEFAULT_RESOURCE : location;
		Resource resource = resourceLoader.getResource(resolved);
		if (!resource.exists()) {
			throw new IllegalStateException("Historical reference resource not found: " + resolved);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			List<HistoricalReference> entries = objectMapper.readValue(inputStream, new TypeReference<>() {
			});
			HistoricalReferenceTable table = new HistoricalReferenceTable(entries);
			logger.info("Loaded {} historical references from {}", table.size(), resolved);
			return table;
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read historical references from " + resolved, ex);
		}
	}
}
