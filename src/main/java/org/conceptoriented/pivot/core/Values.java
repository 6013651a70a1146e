package org.conceptoriented.pivot.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Date;

/**
 * Helpers for comparing and converting boxed cell values.
 */
public final class Values {

	/**
	 * Total order on cell values: null first, numbers by magnitude, other comparables naturally, everything else by string.
	 */
	public static final Comparator<Object> ORDER = Values::compare;

	public static int compare(Object a, Object b) {
		if(a == b) return 0;
		if(a == null) return -1;
		if(b == null) return 1;

		if(a instanceof Number && b instanceof Number) {
			if(isIntegral(a) && isIntegral(b)) {
				return Long.compare(((Number)a).longValue(), ((Number)b).longValue());
			}
			return Double.compare(((Number)a).doubleValue(), ((Number)b).doubleValue());
		}
		if(a instanceof Comparable && a.getClass() == b.getClass()) {
			Comparable<Object> c = (Comparable<Object>)a;
			return c.compareTo(b);
		}
		return a.toString().compareTo(b.toString());
	}

	public static boolean equal(Object a, Object b) {
		if(a instanceof Number && b instanceof Number) {
			return compare(a, b) == 0;
		}
		return com.google.common.base.Objects.equal(a, b);
	}

	public static boolean isIntegral(Object value) {
		return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
	}

	public static double toDouble(Object value) {
		if(value instanceof Number) return ((Number)value).doubleValue();
		if(value instanceof Boolean) return ((Boolean)value) ? 1.0 : 0.0;
		throw new DcFault("Value is not numeric: " + value);
	}

	//
	// Long representation of bool, date and datetime values
	//

	public static long toLong(Object value, DType dtype) {
		if(value instanceof Boolean) {
			return ((Boolean)value) ? 1L : 0L;
		}
		if(dtype == DType.DATE) {
			if(value instanceof LocalDate) return ((LocalDate)value).toEpochDay();
			if(value instanceof Number) return ((Number)value).longValue();
		}
		else if(dtype == DType.TIME) {
			if(value instanceof Instant) return ((Instant)value).toEpochMilli();
			if(value instanceof LocalDateTime) return ((LocalDateTime)value).toInstant(ZoneOffset.UTC).toEpochMilli();
			if(value instanceof Date) return ((Date)value).getTime();
			if(value instanceof LocalDate) return ((LocalDate)value).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
			if(value instanceof Number) return ((Number)value).longValue();
		}
		else if(value instanceof Number) {
			Number n = (Number)value;
			if(!isIntegral(n) && n.doubleValue() != Math.rint(n.doubleValue())) {
				throw new DcFault("Fractional value " + value + " cannot be stored in a " + dtype + " column.");
			}
			return n.longValue();
		}
		throw new DcFault("Value " + value + " cannot be stored in a " + dtype + " column.");
	}

	public static Object fromLong(long value, DType dtype) {
		switch(dtype) {
		case BOOL: return value != 0;
		case DATE: return LocalDate.ofEpochDay(value);
		case TIME: return Instant.ofEpochMilli(value);
		default: return value;
		}
	}

	/**
	 * The boxed form in which columns of the type return their values, so that it can be used as a map key. 
	 * Integral numbers become Long, floating numbers Double, epoch numbers dates or instants. 
	 * Values which cannot be represented are returned unchanged.
	 */
	public static Object canonical(Object value, DType dtype) {
		if(value == null) return null;
		if(dtype.isIntegral()) {
			if(isIntegral(value)) return ((Number)value).longValue();
			if(value instanceof Number && ((Number)value).doubleValue() == Math.rint(((Number)value).doubleValue())) {
				return ((Number)value).longValue();
			}
			return value;
		}
		if(dtype.isFloating()) {
			return value instanceof Number ? (Object)((Number)value).doubleValue() : value;
		}
		switch(dtype) {
		case STR:
			return value instanceof CharSequence ? value.toString() : value;
		case DATE:
			return value instanceof Number ? LocalDate.ofEpochDay(((Number)value).longValue()) : value;
		case TIME:
			if(value instanceof Number || value instanceof LocalDateTime || value instanceof Date || value instanceof LocalDate) {
				return fromLong(toLong(value, dtype), dtype);
			}
			return value;
		default:
			return value;
		}
	}

	private Values() {
	}
}
