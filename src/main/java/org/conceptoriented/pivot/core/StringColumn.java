package org.conceptoriented.pivot.core;

import java.util.Arrays;

/**
 * Column of strings stored as ids into its own {@link Vocabulary}.
 */
public class StringColumn extends Column implements RefCounted {

	private int[] data = new int[0];

	private final Vocabulary vocabulary = new Vocabulary();
	public Vocabulary getVocabulary() {
		return vocabulary;
	}

	public String getString(int row) {
		if(!valid.get(row)) return null;
		return vocabulary.get(data[row]);
	}

	public void setString(int row, String value) {
		if(value == null) {
			setNull(row);
			return;
		}
		checkRow(row);
		int id = vocabulary.acquire(value);
		if(valid.get(row)) release(row);
		data[row] = id;
		markValid(row);
	}

	@Override
	public Object getValue(int row) {
		return getString(row);
	}

	@Override
	protected void store(int row, Object value) {
		setString(row, value.toString());
	}

	@Override
	protected void release(int row) {
		vocabulary.release(data[row]);
	}

	@Override
	protected void copyValid(int row, Column source, int sourceRow) {
		if(source == this) {
			vocabulary.acquire(data[sourceRow]);
			if(valid.get(row)) release(row);
			data[row] = data[sourceRow];
			markValid(row);
		}
		else {
			setString(row, ((StringColumn)source).getString(sourceRow));
		}
	}

	@Override
	protected boolean valueEquals(int row, Column other, int otherRow) {
		if(other == this) {
			return data[row] == data[otherRow];
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
	public int getRefCount(Object payload) {
		return payload == null ? 0 : vocabulary.getRefCount(payload.toString());
	}

	@Override
	public int getPayloadCount() {
		return vocabulary.size();
	}

	@Override
	public Column copy(String name) {
		StringColumn column = new StringColumn(name);
		column.setSize(this.size);
		for(int row = 0; row < this.size; row++) {
			column.copyCell(row, this, row);
		}
		return column;
	}

	public StringColumn(String name) {
		super(name, DType.STR);
	}
}
