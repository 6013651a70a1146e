package org.conceptoriented.pivot.core;

import java.util.BitSet;

/**
 * Typed column of cells. Every cell has a validity flag and an assignment flag so that an explicit null 
 * can be distinguished from a cell which was not written at all.
 */
public abstract class Column {

	private final String name;
	public String getName() {
		return this.name;
	}

	private final DType dtype;
	public DType getDType() {
		return this.dtype;
	}

	protected int size;
	public int size() {
		return this.size;
	}

	//
	// Cell status
	//

	protected final BitSet valid = new BitSet();
	protected final BitSet assigned = new BitSet();

	public boolean isValid(int row) {
		return valid.get(row);
	}

	public boolean isSet(int row) {
		return assigned.get(row);
	}

	public CellState getState(int row) {
		if(valid.get(row)) return CellState.VALID;
		if(assigned.get(row)) return CellState.NULL;
		return CellState.UNSET;
	}

	public int getNullCount() {
		return this.size - this.valid.cardinality();
	}

	protected void checkRow(int row) {
		if(row < 0 || row >= this.size) {
			throw new DcFault("Row " + row + " is out of range for column '" + this.name + "' of size " + this.size + ".");
		}
	}

	protected void markValid(int row) {
		valid.set(row);
		assigned.set(row);
	}

	//
	// Data access
	//

	/**
	 * Boxed value of the cell or null if the cell is not valid.
	 */
	public abstract Object getValue(int row);

	public void setValue(int row, Object value) {
		if(value == null) {
			setNull(row);
		}
		else {
			checkRow(row);
			store(row, value);
		}
	}

	protected abstract void store(int row, Object value);

	public void setNull(int row) {
		checkRow(row);
		if(valid.get(row)) release(row);
		valid.clear(row);
		assigned.set(row);
	}

	public void unset(int row) {
		checkRow(row);
		if(valid.get(row)) release(row);
		valid.clear(row);
		assigned.clear(row);
	}

	/**
	 * Called before a valid cell payload is overwritten or dropped.
	 */
	protected void release(int row) {
	}

	/**
	 * Copy one cell (including its null or unset status) from a column of the same type.
	 */
	public void copyCell(int row, Column source, int sourceRow) {
		if(source.getClass() != this.getClass()) {
			throw new DcFault("Cannot copy cell of column '" + source.getName() + "' (" + source.getDType() + ") to column '" + this.name + "' (" + this.dtype + ").");
		}
		if(source.isValid(sourceRow)) {
			checkRow(row);
			copyValid(row, source, sourceRow);
		}
		else if(source.isSet(sourceRow)) {
			setNull(row);
		}
		else {
			unset(row);
		}
	}

	protected abstract void copyValid(int row, Column source, int sourceRow);

	/**
	 * Two invalid cells are equal, an invalid cell is never equal to a valid one.
	 */
	public boolean cellEquals(int row, Column other, int otherRow) {
		boolean v1 = isValid(row);
		boolean v2 = other.isValid(otherRow);
		if(!v1 || !v2) return v1 == v2;
		return valueEquals(row, other, otherRow);
	}

	protected boolean valueEquals(int row, Column other, int otherRow) {
		return Values.equal(getValue(row), other.getValue(otherRow));
	}

	//
	// Size
	//

	public void setSize(int newSize) {
		if(newSize < 0) {
			throw new DcFault("Negative column size.");
		}
		for(int row = newSize; row < this.size; row++) {
			if(valid.get(row)) release(row);
		}
		if(newSize < this.size) {
			valid.clear(newSize, this.size);
			assigned.clear(newSize, this.size);
		}
		ensureCapacity(newSize);
		this.size = newSize;
	}

	public void extend(int count) {
		setSize(this.size + count);
	}

	public void clear() {
		setSize(0);
	}

	protected abstract void ensureCapacity(int capacity);

	protected static int grow(int current, int required) {
		int capacity = Math.max(current, 16);
		while(capacity < required) capacity = capacity + (capacity >> 1);
		return capacity;
	}

	/**
	 * Deep copy with a new name. Reference counted payloads are re-acquired by the copy.
	 */
	public abstract Column copy(String name);

	@Override
	public String toString() {
		return "[" + this.name + "]";
	}

	protected Column(String name, DType dtype) {
		this.name = name;
		this.dtype = dtype;
	}
}
