package org.conceptoriented.pivot.core;

import java.util.Arrays;

/**
 * Column of floating point values. Values of 32 bit columns are rounded to float precision when stored.
 */
public class DoubleColumn extends Column {

	private double[] data = new double[0];

	public double getDouble(int row) {
		return data[row];
	}

	public void setDouble(int row, double value) {
		checkRow(row);
		data[row] = getDType() == DType.FLOAT32 ? (float)value : value;
		markValid(row);
	}

	@Override
	public Object getValue(int row) {
		if(!valid.get(row)) return null;
		return data[row];
	}

	@Override
	protected void store(int row, Object value) {
		if(!(value instanceof Number)) {
			throw new DcFault("Value " + value + " cannot be stored in a " + getDType() + " column.");
		}
		setDouble(row, ((Number)value).doubleValue());
	}

	@Override
	protected void copyValid(int row, Column source, int sourceRow) {
		data[row] = ((DoubleColumn)source).data[sourceRow];
		markValid(row);
	}

	@Override
	protected boolean valueEquals(int row, Column other, int otherRow) {
		if(other instanceof DoubleColumn) {
			return Double.compare(data[row], ((DoubleColumn)other).data[otherRow]) == 0;
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
		DoubleColumn column = new DoubleColumn(name, getDType());
		column.setSize(this.size);
		System.arraycopy(this.data, 0, column.data, 0, this.size);
		column.valid.or(this.valid);
		column.assigned.or(this.assigned);
		return column;
	}

	public DoubleColumn(String name, DType dtype) {
		super(name, dtype);
		if(!dtype.isFloating()) {
			throw new DcFault("Type " + dtype + " cannot be stored in a double column.");
		}
	}
}
