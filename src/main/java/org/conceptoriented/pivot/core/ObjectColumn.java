package org.conceptoriented.pivot.core;

import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Column of opaque payloads. Payloads are compared by identity and reference counted. 
 * The release listener is called when the last cell referencing a payload is dropped.
 */
public class ObjectColumn extends Column implements RefCounted {

	private Object[] data = new Object[0];

	private final Map<Object, Integer> refs = new IdentityHashMap<>();

	private Consumer<Object> releaseListener;
	public Consumer<Object> getReleaseListener() {
		return releaseListener;
	}
	public void setReleaseListener(Consumer<Object> releaseListener) {
		this.releaseListener = releaseListener;
	}

	@Override
	public Object getValue(int row) {
		if(!valid.get(row)) return null;
		return data[row];
	}

	@Override
	protected void store(int row, Object value) {
		Integer count = refs.get(value);
		refs.put(value, count == null ? 1 : count + 1);
		if(valid.get(row)) release(row);
		data[row] = value;
		markValid(row);
	}

	@Override
	protected void release(int row) {
		Object value = data[row];
		data[row] = null;
		Integer count = refs.get(value);
		if(count == null) {
			throw new DcFault("Payload released more times than acquired in column '" + getName() + "'.");
		}
		if(count == 1) {
			refs.remove(value);
			if(releaseListener != null) releaseListener.accept(value);
		}
		else {
			refs.put(value, count - 1);
		}
	}

	@Override
	protected void copyValid(int row, Column source, int sourceRow) {
		store(row, source.getValue(sourceRow));
	}

	@Override
	protected boolean valueEquals(int row, Column other, int otherRow) {
		return data[row] == other.getValue(otherRow);
	}

	@Override
	protected void ensureCapacity(int capacity) {
		if(capacity > data.length) {
			data = Arrays.copyOf(data, grow(data.length, capacity));
		}
	}

	@Override
	public int getRefCount(Object payload) {
		Integer count = refs.get(payload);
		return count == null ? 0 : count;
	}

	@Override
	public int getPayloadCount() {
		return refs.size();
	}

	@Override
	public Column copy(String name) {
		ObjectColumn column = new ObjectColumn(name);
		column.releaseListener = this.releaseListener;
		column.setSize(this.size);
		for(int row = 0; row < this.size; row++) {
			column.copyCell(row, this, row);
		}
		return column;
	}

	public ObjectColumn(String name) {
		super(name, DType.OBJECT);
	}
}
