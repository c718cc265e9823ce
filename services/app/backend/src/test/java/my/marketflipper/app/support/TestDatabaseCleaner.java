package my.marketflipper.app.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class TestDatabaseCleaner {
	private final JdbcTemplate jdbcTemplate;

	public TestDatabaseCleaner(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	public void clean() {
		jdbcTemplate.update("delete from store_records");
	}
}
