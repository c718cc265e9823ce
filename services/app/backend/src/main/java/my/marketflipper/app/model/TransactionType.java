package my.marketflipper.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TransactionType {
	@JsonProperty("purchase")
	PURCHASE,
	@JsonProperty("sale")
	SALE
}
