package org.conceptoriented.pivot.core;

/**
 * Physical data types of column cells. Every type maps to one canonical name used in user-facing schemas.
 */
public enum DType {
	BOOL("boolean", 0, 1),
	INT8("integer", Byte.MIN_VALUE, Byte.MAX_VALUE),
	INT16("integer", Short.MIN_VALUE, Short.MAX_VALUE),
	INT32("integer", Integer.MIN_VALUE, Integer.MAX_VALUE),
	INT64("integer", Long.MIN_VALUE, Long.MAX_VALUE),
	UINT8("integer", 0, 0xFFL),
	UINT16("integer", 0, 0xFFFFL),
	UINT32("integer", 0, 0xFFFFFFFFL),
	UINT64("integer", 0, Long.MAX_VALUE),
	FLOAT32("float", 0, 0),
	FLOAT64("float", 0, 0),
	STR("string", 0, 0),
	DATE("date", 0, 0),
	TIME("datetime", 0, 0),
	OBJECT("object", 0, 0),
	;

	private final String typeName;
	public String getTypeName() {
		return typeName;
	}

	private final long minValue;
	private final long maxValue;

	public boolean isIntegral() {
		switch(this) {
		case INT8: case INT16: case INT32: case INT64:
		case UINT8: case UINT16: case UINT32: case UINT64:
			return true;
		default:
			return false;
		}
	}

	public boolean isFloating() {
		return this == FLOAT32 || this == FLOAT64;
	}

	public boolean isNumeric() {
		return isIntegral() || isFloating();
	}

	/**
	 * Types stored as a primitive long in the column data.
	 */
	public boolean isLongBacked() {
		return isIntegral() || this == BOOL || this == DATE || this == TIME;
	}

	public boolean fits(long value) {
		if(!isIntegral()) return false;
		return value >= minValue && value <= maxValue;
	}

	/**
	 * Whether values of this type can be widened to the target type without losing information (apart from float precision).
	 */
	public boolean canPromoteTo(DType target) {
		if(target == this) return true;
		if(target == STR) return this != OBJECT;
		if(this.isIntegral()) {
			if(target.isFloating()) return true;
			if(target.isIntegral()) {
				return target.minValue <= this.minValue && target.maxValue >= this.maxValue;
			}
			return false;
		}
		if(this == FLOAT32) return target == FLOAT64;
		if(this == DATE) return target == TIME;
		return false;
	}

	/**
	 * Value used to fill cells when a column is added or promoted with the default fill option.
	 */
	public Object getDefaultValue() {
		if(isIntegral()) return 0L;
		if(isFloating()) return 0.0;
		switch(this) {
		case BOOL: return false;
		case STR: return "";
		case DATE: return java.time.LocalDate.ofEpochDay(0);
		case TIME: return java.time.Instant.ofEpochMilli(0);
		default: return null;
		}
	}

	public Column newColumn(String name) {
		if(isLongBacked()) {
			return new LongColumn(name, this);
		}
		else if(isFloating()) {
			return new DoubleColumn(name, this);
		}
		else if(this == STR) {
			return new StringColumn(name);
		}
		else {
			return new ObjectColumn(name);
		}
	}

	/**
	 * Resolve a type from its canonical name ("integer", "float" etc.) or from one of the enum names ("int32", "float64" etc.). 
	 */
	public static DType fromName(String name) throws DcError {
		if(name == null) {
			throw new DcError(DcErrorCode.UNSUPPORTED_TYPE, "Type name is not specified.", "");
		}
		String n = name.trim().toLowerCase();
		switch(n) {
		case "integer": case "int": return INT32;
		case "float": case "double": return FLOAT64;
		case "string": case "str": return STR;
		case "boolean": case "bool": return BOOL;
		case "date": return DATE;
		case "datetime": case "time": return TIME;
		case "object": return OBJECT;
		}
		for(DType t : values()) {
			if(t.name().equalsIgnoreCase(n)) return t;
		}
		throw new DcError(DcErrorCode.UNSUPPORTED_TYPE, "Unknown type name.", "Type '" + name + "' is not supported.");
	}

	private DType(String typeName, long minValue, long maxValue) {
		this.typeName = typeName;
		this.minValue = minValue;
		this.maxValue = maxValue;
	}
}
