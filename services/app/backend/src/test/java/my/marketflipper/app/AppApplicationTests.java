package my.marketflipper.app;

import my.marketflipper.app.model.HistoricalReferenceTable;
import my.marketflipper.app.source.ListingSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private HistoricalReferenceTable references;

	@Autowired
	private List<ListingSource> sources;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
	}

	@Test
	void contextLoads() {
		assertThat(references.size()).isEqualTo(12);
		assertThat(sources).extracting(ListingSource::name).containsExactly("facebook");
	}
}
