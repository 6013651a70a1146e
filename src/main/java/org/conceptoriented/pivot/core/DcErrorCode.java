package org.conceptoriented.pivot.core;

public enum DcErrorCode {
	NONE(0), 
	GENERAL(1), 
	INVALID_CONFIG(20), UNKNOWN_COLUMN(21), SCHEMA_MISMATCH(22), UNSUPPORTED_TYPE(23),
	STALE_VIEW(30), INVALID_STATE(31),
	PARSE_ERROR(51), BIND_ERROR(52), EVALUATE_ERROR(53),
	FAULT(90),
	;

	private int value;

	public int getValue() {
		return value;
	}

	private DcErrorCode(int value) {
		this.value = value;
	}
}
