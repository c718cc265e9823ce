package my.marketflipper.app.repository;

import my.marketflipper.app.domain.StoreRecord;
import my.marketflipper.app.domain.StoreRecordId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StoreRecordRepository extends JpaRepository<StoreRecord, StoreRecordId> {
	@Query("select r.recordKey from StoreRecord r where r.bucket = :bucket order by r.recordKey")
	List<String> findKeysByBucket(@Param("bucket") String bucket);
}
