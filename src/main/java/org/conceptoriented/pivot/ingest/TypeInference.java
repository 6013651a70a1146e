package org.conceptoriented.pivot.ingest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.Record;
import org.conceptoriented.pivot.core.Schema;

/**
 * Column types of untyped values. Types form a lattice: 
 * boolean, integer (int32 widened to int64), float, date, datetime, string, object. 
 * Text values are parsed, so CSV input gets the same types as JSON input.
 */
public final class TypeInference {

	private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
	private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?|[-+]?(NaN|Infinity)");
	private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

	/**
	 * Schema of the records. Columns are ordered by first appearance. Columns without non-null values are strings.
	 */
	public static Schema infer(List<Record> records) {
		Map<String, DType> types = new LinkedHashMap<>();
		for(Record r : records) {
			for(String name : r.getNames()) {
				DType t = classify(r.get(name));
				DType current = types.get(name);
				if(current == null) {
					types.put(name, t);
				}
				else if(t != null) {
					types.put(name, join(current, t));
				}
			}
		}
		Schema schema = new Schema();
		types.forEach((name, t) -> schema.addColumn(name, t == null ? DType.STR : t));
		return schema;
	}

	/**
	 * Narrowest type of one value or null for null.
	 */
	public static DType classify(Object value) {
		if(value == null) return null;
		if(value instanceof Boolean) return DType.BOOL;
		if(value instanceof Integer || value instanceof Short || value instanceof Byte) return DType.INT32;
		if(value instanceof Long) return integral((Long)value);
		if(value instanceof BigInteger) {
			BigInteger b = (BigInteger)value;
			return b.bitLength() < 64 ? integral(b.longValue()) : DType.FLOAT64;
		}
		if(value instanceof Number) return DType.FLOAT64;
		if(value instanceof LocalDate) return DType.DATE;
		if(value instanceof Instant || value instanceof LocalDateTime || value instanceof OffsetDateTime || value instanceof Date) return DType.TIME;
		if(value instanceof String) return classifyText(((String)value).trim());
		return DType.OBJECT;
	}

	private static DType integral(long value) {
		return DType.INT32.fits(value) ? DType.INT32 : DType.INT64;
	}

	private static DType classifyText(String s) {
		if(s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) return DType.BOOL;
		if(INTEGER.matcher(s).matches()) {
			try {
				return integral(Long.parseLong(s));
			}
			catch(NumberFormatException e) {
				return DType.FLOAT64;
			}
		}
		if(FLOAT.matcher(s).matches()) return DType.FLOAT64;
		if(DATE.matcher(s).matches() && parseDate(s) != null) return DType.DATE;
		if(s.length() > 10 && DATE.matcher(s.substring(0, 10)).matches() && parseDateTime(s) != null) return DType.TIME;
		return DType.STR;
	}

	/**
	 * Least type which can represent values of both types.
	 */
	public static DType join(DType a, DType b) {
		if(a == b) return a;
		if(a == DType.OBJECT || b == DType.OBJECT) return DType.OBJECT;
		if(a.isIntegral() && b.isIntegral()) {
			return a.canPromoteTo(b) ? b : b.canPromoteTo(a) ? a : DType.FLOAT64;
		}
		if(a.isNumeric() && b.isNumeric()) return DType.FLOAT64;
		if((a == DType.DATE && b == DType.TIME) || (a == DType.TIME && b == DType.DATE)) return DType.TIME;
		return DType.STR;
	}

	//
	// Parsing
	//

	public static LocalDate parseDate(String s) {
		try {
			return LocalDate.parse(s.trim());
		}
		catch(DateTimeParseException e) {
			return null;
		}
	}

	/**
	 * ISO-8601 date-time with an offset or a local date-time taken as UTC. A space may separate date and time.
	 */
	public static Instant parseDateTime(String s) {
		String t = s.trim().replace(' ', 'T');
		try {
			return OffsetDateTime.parse(t).toInstant();
		}
		catch(DateTimeParseException e) {
			try {
				return LocalDateTime.parse(t).toInstant(ZoneOffset.UTC);
			}
			catch(DateTimeParseException e2) {
				return null;
			}
		}
	}

	/**
	 * Numeric value of a number or numeric text or null.
	 */
	public static Number parseNumber(Object value) {
		if(value instanceof BigDecimal) {
			return ((BigDecimal)value).doubleValue();
		}
		if(value instanceof BigInteger) {
			BigInteger b = (BigInteger)value;
			if(b.bitLength() < 64) return Long.valueOf(b.longValue());
			return Double.valueOf(b.doubleValue());
		}
		if(value instanceof Number) return (Number)value;
		if(value instanceof String) {
			String s = ((String)value).trim();
			if(INTEGER.matcher(s).matches()) {
				try {
					return Long.parseLong(s);
				}
				catch(NumberFormatException e) {
					return Double.parseDouble(s);
				}
			}
			if(FLOAT.matcher(s).matches()) return Double.parseDouble(s);
		}
		return null;
	}

	private TypeInference() {
	}
}
