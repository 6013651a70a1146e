package org.conceptoriented.pivot.view;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import org.conceptoriented.pivot.core.DType;

/**
 * Values of one view column with a validity bitmap. This is what a columnar serializer consumes.
 */
public class ColumnVector {

	private final String name;
	public String getName() {
		return name;
	}

	private final DType dtype;
	public DType getDType() {
		return dtype;
	}

	private final List<Object> values;
	public List<Object> getValues() {
		return values;
	}
	public int size() {
		return values.size();
	}

	private final BitSet validity;
	public BitSet getValidity() {
		return (BitSet)validity.clone();
	}
	public boolean isValid(int row) {
		return validity.get(row);
	}

	public int getNullCount() {
		return values.size() - validity.cardinality();
	}

	@Override
	public String toString() {
		return "[" + name + ":" + dtype.getTypeName() + " " + values.size() + " values, " + getNullCount() + " nulls]";
	}

	public ColumnVector(String name, DType dtype, List<Object> values) {
		this.name = name;
		this.dtype = dtype;
		this.values = Collections.unmodifiableList(values);
		this.validity = new BitSet(values.size());
		for(int i = 0; i < values.size(); i++) {
			if(values.get(i) != null) validity.set(i);
		}
	}
}
