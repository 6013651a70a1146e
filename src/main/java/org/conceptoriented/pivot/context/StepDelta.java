package org.conceptoriented.pivot.context;

import java.util.Collections;
import java.util.List;

/**
 * Cells changed since the previous read together with flags telling whether rows or columns were added or removed.
 */
public final class StepDelta {

	private final boolean rowsChanged;
	public boolean isRowsChanged() {
		return rowsChanged;
	}

	private final boolean columnsChanged;
	public boolean isColumnsChanged() {
		return columnsChanged;
	}

	private final List<CellDelta> cells;
	public List<CellDelta> getCells() {
		return cells;
	}

	@Override
	public String toString() {
		return "[rows=" + rowsChanged + ", columns=" + columnsChanged + ", cells=" + cells + "]";
	}

	public StepDelta(boolean rowsChanged, boolean columnsChanged, List<CellDelta> cells) {
		this.rowsChanged = rowsChanged;
		this.columnsChanged = columnsChanged;
		this.cells = Collections.unmodifiableList(cells);
	}
}
