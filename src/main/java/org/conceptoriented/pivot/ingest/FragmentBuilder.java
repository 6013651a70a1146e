package org.conceptoriented.pivot.ingest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Record;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.conceptoriented.pivot.gnode.Gnode;
import org.conceptoriented.pivot.gnode.Op;
import org.jboss.logging.Logger;

/**
 * Converts records to fragments with the input schema of a gnode. 
 * A field missing in a record leaves the cell unset, a null field sets it to null. 
 * Values which do not fit the type of their column widen the column before the fragment is built.
 */
public class FragmentBuilder {
	private static final Logger LOG = Logger.getLogger(FragmentBuilder.class);

	private final Gnode gnode;

	/**
	 * Check that all fields are known columns. Nothing is changed.
	 */
	public void validate(List<Record> records) throws DcError {
		Schema schema = gnode.getOutputSchema();
		for(Record r : records) {
			for(String name : r.getNames()) {
				if(!schema.hasColumn(name)) {
					throw new DcError(DcErrorCode.SCHEMA_MISMATCH, "Unknown column.", "Column '" + name + "' is not in the schema " + schema + ".");
				}
			}
		}
	}

	/**
	 * Types the columns need to take all values of the records. Only columns which have to change are returned.
	 */
	public Map<String, DType> getPromotions(List<Record> records) {
		Schema schema = gnode.getOutputSchema();
		Map<String, DType> promotions = new LinkedHashMap<>();
		for(Record r : records) {
			for(String name : r.getNames()) {
				DType current = promotions.containsKey(name) ? promotions.get(name) : schema.getType(name);
				DType required = required(r.get(name), current);
				if(required != current) promotions.put(name, required);
			}
		}
		return promotions;
	}

	/**
	 * Build a fragment of insert rows. Columns are promoted first if the values need it.
	 */
	public Table build(List<Record> records, List<Object> pkeys, Op op) throws DcError {
		validate(records);
		for(Map.Entry<String, DType> p : getPromotions(records).entrySet()) {
			LOG.debugf("Promoting column '%s' to %s for incoming values", p.getKey(), p.getValue());
			gnode.promoteColumn(p.getKey(), p.getValue());
		}

		Schema schema = gnode.getInputSchema();
		DType pkeyType = gnode.getPkeyType();
		Table fragment = new Table("fragment", schema);
		fragment.setSize(records.size());
		Column pkeyColumn = fragment.getColumn(Schema.PKEY);
		Column opColumn = fragment.getColumn(Schema.OP);
		for(int row = 0; row < records.size(); row++) {
			Record r = records.get(row);
			for(String name : r.getNames()) {
				DType dtype = schema.getType(name);
				fragment.getColumn(name).setValue(row, convert(r.get(name), dtype));
			}
			pkeyColumn.setValue(row, convert(pkeys.get(row), pkeyType));
			opColumn.setValue(row, (long)op.getValue());
		}
		return fragment;
	}

	/**
	 * Fragment with one row per key and all data cells unset.
	 */
	public Table buildKeys(List<Object> pkeys, Op op) {
		Table fragment = new Table("fragment", gnode.getInputSchema());
		fragment.setSize(pkeys.size());
		Column pkeyColumn = fragment.getColumn(Schema.PKEY);
		Column opColumn = fragment.getColumn(Schema.OP);
		for(int row = 0; row < pkeys.size(); row++) {
			pkeyColumn.setValue(row, convert(pkeys.get(row), gnode.getPkeyType()));
			opColumn.setValue(row, (long)op.getValue());
		}
		return fragment;
	}

	//
	// Coercion
	//

	/**
	 * Whether the value can be stored in a column of the type after conversion.
	 */
	public static boolean fits(Object value, DType dtype) {
		if(value == null) return true;
		switch(dtype) {
		case OBJECT:
		case STR:
			return true;
		case BOOL:
			return TypeInference.classify(value) == DType.BOOL;
		case DATE:
			return TypeInference.classify(value) == DType.DATE;
		case TIME:
			DType t = TypeInference.classify(value);
			return t == DType.TIME || t == DType.DATE || (value instanceof Number && TypeInference.classify(value).isIntegral());
		default:
			break;
		}
		Number n = TypeInference.parseNumber(value);
		if(n == null) return false;
		if(dtype.isFloating()) return true;
		if(n instanceof Double || n instanceof Float) {
			double d = n.doubleValue();
			return d == Math.rint(d) && !Double.isInfinite(d) && dtype.fits((long)d) && (double)(long)d == d;
		}
		return dtype.fits(n.longValue());
	}

	/**
	 * Type of a column which can take the value: the current type if it fits, otherwise the least wider type.
	 */
	public static DType required(Object value, DType current) {
		if(fits(value, current)) return current;
		DType vt = TypeInference.classify(value);
		if(current.isIntegral() && vt.isIntegral()) {
			return DType.INT64.fits(TypeInference.parseNumber(value).longValue()) ? DType.INT64 : DType.FLOAT64;
		}
		DType joined = TypeInference.join(current, vt);
		if(current.canPromoteTo(joined)) return joined;
		return DType.STR;
	}

	/**
	 * Canonical value for a column of the type. The value has to fit the type.
	 */
	public static Object convert(Object value, DType dtype) {
		if(value == null) return null;
		switch(dtype) {
		case OBJECT:
			return value;
		case STR:
			return value.toString();
		case BOOL:
			if(value instanceof Boolean) return value;
			return Boolean.parseBoolean(value.toString().trim());
		case DATE:
			if(value instanceof LocalDate) return value;
			return TypeInference.parseDate(value.toString());
		case TIME:
			if(value instanceof Instant) return value;
			if(value instanceof LocalDateTime) return ((LocalDateTime)value).toInstant(ZoneOffset.UTC);
			if(value instanceof OffsetDateTime) return ((OffsetDateTime)value).toInstant();
			if(value instanceof Date) return ((Date)value).toInstant();
			if(value instanceof LocalDate) return ((LocalDate)value).atStartOfDay().toInstant(ZoneOffset.UTC);
			if(value instanceof Number) return Instant.ofEpochMilli(((Number)value).longValue());
			String s = value.toString();
			Instant i = TypeInference.parseDateTime(s);
			if(i != null) return i;
			LocalDate d = TypeInference.parseDate(s);
			return d == null ? null : d.atStartOfDay().toInstant(ZoneOffset.UTC);
		default:
			break;
		}
		Number n = TypeInference.parseNumber(value);
		if(dtype.isFloating()) return n.doubleValue();
		return n.longValue();
	}

	public FragmentBuilder(Gnode gnode) {
		this.gnode = gnode;
	}
}
