package org.conceptoriented.pivot.context;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;

public enum AggType {
	SUM("sum"),
	COUNT("count"),
	MEAN("mean"),
	DISTINCT_COUNT("distinct count"),
	MIN("min"),
	MAX("max"),
	UNIQUE("unique"),
	WEIGHTED_MEAN("weighted mean"),
	PCT_SUM_PARENT("pct sum parent"),
	PCT_SUM_GRAND_TOTAL("pct sum grand total"),
	ANY("any"),
	;

	private final String name;
	public String getName() {
		return name;
	}

	public boolean requiresNumeric() {
		return this == SUM || this == MEAN || this == WEIGHTED_MEAN || this == PCT_SUM_PARENT || this == PCT_SUM_GRAND_TOTAL;
	}

	/**
	 * Type of the aggregate values for an input column of the specified type.
	 */
	public DType getOutputType(DType input) {
		switch(this) {
		case COUNT:
		case DISTINCT_COUNT:
			return DType.INT64;
		case MEAN:
		case WEIGHTED_MEAN:
		case PCT_SUM_PARENT:
		case PCT_SUM_GRAND_TOTAL:
			return DType.FLOAT64;
		case SUM:
			return input.isIntegral() || input == DType.BOOL ? DType.INT64 : DType.FLOAT64;
		default:
			return input;
		}
	}

	/**
	 * Default aggregate of a column which is not explicitly configured.
	 */
	public static AggType getDefault(DType input) {
		return input.isNumeric() ? SUM : COUNT;
	}

	public static AggType fromName(String name) throws DcError {
		if(name != null) {
			String n = name.trim().toLowerCase().replace('_', ' ');
			if(n.equals("avg")) return MEAN;
			if(n.equals("distinctcount") || n.equals("dcount")) return DISTINCT_COUNT;
			for(AggType t : values()) {
				if(t.name.equals(n)) return t;
			}
		}
		throw new DcError(DcErrorCode.INVALID_CONFIG, "Unknown aggregate.", "Aggregate '" + name + "' is not supported.");
	}

	private AggType(String name) {
		this.name = name;
	}
}
