package org.conceptoriented.pivot.context;

import java.util.Collections;
import java.util.List;

/**
 * Visible rows changed since the previous read with all their values.
 */
public final class RowDelta {

	private final List<Integer> rows;
	public List<Integer> getRows() {
		return rows;
	}

	// Row-major values of the changed rows
	private final List<Object> data;
	public List<Object> getData() {
		return data;
	}

	public int getNumRowsChanged() {
		return rows.size();
	}

	@Override
	public String toString() {
		return "[rows=" + rows + "]";
	}

	public RowDelta(List<Integer> rows, List<Object> data) {
		this.rows = Collections.unmodifiableList(rows);
		this.data = Collections.unmodifiableList(data);
	}
}
