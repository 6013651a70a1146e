package org.conceptoriented.pivot.core;

import java.util.Arrays;

/**
 * Column of integer, boolean, date (epoch days) and datetime (epoch milliseconds) values stored as primitive longs.
 */
public class LongColumn extends Column {

	private long[] data = new long[0];

	public long getLong(int row) {
		return data[row];
	}

	public void setLong(int row, long value) {
		checkRow(row);
		data[row] = value;
		markValid(row);
	}

	@Override
	public Object getValue(int row) {
		if(!valid.get(row)) return null;
		return Values.fromLong(data[row], getDType());
	}

	@Override
	protected void store(int row, Object value) {
		data[row] = Values.toLong(value, getDType());
		markValid(row);
	}

	@Override
	protected void copyValid(int row, Column source, int sourceRow) {
		data[row] = ((LongColumn)source).data[sourceRow];
		markValid(row);
	}

	@Override
	protected boolean valueEquals(int row, Column other, int otherRow) {
		if(other instanceof LongColumn) {
			return data[row] == ((LongColumn)other).data[otherRow];
		}
		return super.valueEquals(row, other, otherRow);
	}

	@Override
	protected void ensureCapacity(int capacity) {
		if(capacity > data.length) {
			data = Arrays.copyOf(data, grow(data.length, capacity));
		}
	}

	@Override
	public Column copy(String name) {
		LongColumn column = new LongColumn(name, getDType());
		column.setSize(this.size);
		System.arraycopy(this.data, 0, column.data, 0, this.size);
		column.valid.or(this.valid);
		column.assigned.or(this.assigned);
		return column;
	}

	public LongColumn(String name, DType dtype) {
		super(name, dtype);
		if(!dtype.isLongBacked()) {
			throw new DcFault("Type " + dtype + " cannot be stored in a long column.");
		}
	}
}
