package org.conceptoriented.pivot.context;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;

/**
 * One predicate of a filter: column, operator and operand.
 */
public final class FilterTerm {

	private final String column;
	public String getColumn() {
		return column;
	}

	private final FilterOp op;
	public FilterOp getOp() {
		return op;
	}

	private final Object operand;
	public Object getOperand() {
		return operand;
	}

	public boolean test(Object cell) {
		return op.test(cell, operand);
	}

	/**
	 * Term with the operand converted to the type of the column.
	 */
	public FilterTerm bind(DType dtype) throws DcError {
		if(op.isUnary()) return this;
		if(op.isSetOp()) {
			if(!(operand instanceof Collection)) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid filter.", "Operator '" + op.getSymbol() + "' requires a list of values.");
			}
			List<Object> values = new ArrayList<>();
			for(Object v : (Collection<?>)operand) {
				values.add(convert(v, dtype));
			}
			return new FilterTerm(column, op, values);
		}
		if(operand == null) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid filter.", "Operator '" + op.getSymbol() + "' requires a value.");
		}
		if(op == FilterOp.BEGINS_WITH || op == FilterOp.ENDS_WITH || op == FilterOp.CONTAINS) {
			return this;
		}
		return new FilterTerm(column, op, convert(operand, dtype));
	}

	private Object convert(Object value, DType dtype) throws DcError {
		if(!(value instanceof String)) return value;
		String s = ((String)value).trim();
		try {
			if(dtype.isIntegral()) return Long.parseLong(s);
			if(dtype.isFloating()) return Double.parseDouble(s);
			if(dtype == DType.BOOL) return Boolean.parseBoolean(s);
			if(dtype == DType.DATE) return LocalDate.parse(s);
			if(dtype == DType.TIME) {
				if(s.endsWith("Z")) return Instant.parse(s);
				return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
			}
		}
		catch(NumberFormatException | DateTimeParseException e) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid filter.", "Value '" + value + "' does not match the type of column '" + column + "'.", e);
		}
		return value;
	}

	@Override
	public String toString() {
		return "[" + column + " " + op.getSymbol() + (op.isUnary() ? "" : " " + operand) + "]";
	}

	public FilterTerm(String column, FilterOp op, Object operand) {
		this.column = column;
		this.op = op;
		this.operand = operand;
	}
}
