package my.marketflipper.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "store_records")
@IdClass(StoreRecordId.class)
public class StoreRecord {
	@Id
	@Column(name = "bucket")
	private String bucket;

	@Id
	@Column(name = "record_key")
	private String recordKey;

	@Column(name = "payload", columnDefinition = "TEXT", nullable = false)
	private String payload;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public String getBucket() {
		return bucket;
	}

	public void setBucket(String bucket) {
		this.bucket = bucket;
	}

	public String getRecordKey() {
		return recordKey;
	}

	public void setRecordKey(String recordKey) {
		this.recordKey = recordKey;
	}

	public String getPayload() {
		return payload;
	}

	public void setPayload(String payload) {
		this.payload = payload;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
