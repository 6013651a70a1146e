package org.conceptoriented.pivot.context;

import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Values;

public enum SortOrder {
	ASC("asc", 1, false, false),
	DESC("desc", -1, false, false),
	NONE("none", 0, false, false),
	ASC_ABS("asc abs", 1, true, false),
	DESC_ABS("desc abs", -1, true, false),
	COL_ASC("col asc", 1, false, true),
	COL_DESC("col desc", -1, false, true),
	COL_ASC_ABS("col asc abs", 1, true, true),
	COL_DESC_ABS("col desc abs", -1, true, true),
	;

	private final String name;
	public String getName() {
		return name;
	}

	private final int direction;
	private final boolean abs;
	private final boolean column;

	/**
	 * Orders the column axis instead of the row axis.
	 */
	public boolean isColumnSort() {
		return column;
	}

	public boolean isNone() {
		return direction == 0;
	}

	public int compare(Object a, Object b) {
		if(direction == 0) return 0;
		if(abs) {
			a = absolute(a);
			b = absolute(b);
		}
		return direction * Values.compare(a, b);
	}

	private static Object absolute(Object value) {
		if(value instanceof Long) return Math.abs((Long)value);
		if(value instanceof Number) return Math.abs(((Number)value).doubleValue());
		return value;
	}

	public static SortOrder fromName(String name) throws DcError {
		if(name != null) {
			String n = name.trim().toLowerCase();
			for(SortOrder o : values()) {
				if(o.name.equals(n)) return o;
			}
		}
		throw new DcError(DcErrorCode.INVALID_CONFIG, "Unknown sort order.", "Sort order '" + name + "' is not supported.");
	}

	private SortOrder(String name, int direction, boolean abs, boolean column) {
		this.name = name;
		this.direction = direction;
		this.abs = abs;
		this.column = column;
	}
}
