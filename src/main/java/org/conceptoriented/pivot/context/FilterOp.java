package org.conceptoriented.pivot.context;

import java.util.Collection;

import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Values;

public enum FilterOp {
	EQ("=="),
	NE("!="),
	LT("<"),
	GT(">"),
	LTEQ("<="),
	GTEQ(">="),
	BEGINS_WITH("begins with"),
	ENDS_WITH("ends with"),
	CONTAINS("contains"),
	IN("in"),
	NOT_IN("not in"),
	IS_NULL("is null"),
	IS_NOT_NULL("is not null"),
	;

	private final String symbol;
	public String getSymbol() {
		return symbol;
	}

	/**
	 * Operators without an operand.
	 */
	public boolean isUnary() {
		return this == IS_NULL || this == IS_NOT_NULL;
	}

	public boolean isSetOp() {
		return this == IN || this == NOT_IN;
	}

	/**
	 * Null cells satisfy only the null check.
	 */
	public boolean test(Object cell, Object operand) {
		if(this == IS_NULL) return cell == null;
		if(this == IS_NOT_NULL) return cell != null;
		if(cell == null) return false;

		switch(this) {
		case EQ: return Values.compare(cell, operand) == 0;
		case NE: return Values.compare(cell, operand) != 0;
		case LT: return Values.compare(cell, operand) < 0;
		case GT: return Values.compare(cell, operand) > 0;
		case LTEQ: return Values.compare(cell, operand) <= 0;
		case GTEQ: return Values.compare(cell, operand) >= 0;
		case BEGINS_WITH: return cell.toString().startsWith(String.valueOf(operand));
		case ENDS_WITH: return cell.toString().endsWith(String.valueOf(operand));
		case CONTAINS: return cell.toString().contains(String.valueOf(operand));
		case IN: return contains((Collection<?>)operand, cell);
		case NOT_IN: return !contains((Collection<?>)operand, cell);
		default: return false;
		}
	}

	private static boolean contains(Collection<?> values, Object cell) {
		for(Object v : values) {
			if(Values.equal(v, cell)) return true;
		}
		return false;
	}

	public static FilterOp fromSymbol(String symbol) throws DcError {
		if(symbol != null) {
			String s = symbol.trim().toLowerCase();
			if(s.equals("=")) return EQ;
			for(FilterOp op : values()) {
				if(op.symbol.equals(s)) return op;
			}
		}
		throw new DcError(DcErrorCode.INVALID_CONFIG, "Unknown filter operator.", "Filter operator '" + symbol + "' is not supported.");
	}

	private FilterOp(String symbol) {
		this.symbol = symbol;
	}
}
