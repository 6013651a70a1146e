package org.conceptoriented.pivot.context;

public final class CellDelta {

	private final int row;
	public int getRow() {
		return row;
	}

	private final int column;
	public int getColumn() {
		return column;
	}

	private final Object oldValue;
	public Object getOldValue() {
		return oldValue;
	}

	private final Object newValue;
	public Object getNewValue() {
		return newValue;
	}

	@Override
	public String toString() {
		return "[" + row + "," + column + ": " + oldValue + " -> " + newValue + "]";
	}

	public CellDelta(int row, int column, Object oldValue, Object newValue) {
		this.row = row;
		this.column = column;
		this.oldValue = oldValue;
		this.newValue = newValue;
	}
}
