package my.marketflipper.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum InventoryStatus {
	@JsonProperty("purchased")
	PURCHASED,
	@JsonProperty("listed")
	LISTED,
	@JsonProperty("sold")
	SOLD
}
