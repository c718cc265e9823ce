package my.marketflipper.app.domain;

import java.io.Serializable;
import java.util.Objects;

public class StoreRecordId implements Serializable {
	private String bucket;
	private String recordKey;

	public StoreRecordId() {
	}

	public StoreRecordId(String bucket, String recordKey) {
		this.bucket = bucket;
		this.recordKey = recordKey;
	}

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

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StoreRecordId that)) {
			return false;
		}
		return Objects.equals(bucket, that.bucket)
				&& Objects.equals(recordKey, that.recordKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bucket, recordKey);
	}
}
