package org.conceptoriented.pivot.gnode;

import org.conceptoriented.pivot.core.Table;

/**
 * Per-batch bookkeeping of one processing step. Arrays are indexed by flattened row.
 */
public class ProcessState {

	Table flattened;
	Object[] pkeys;
	Op[] ops;
	boolean[] reset;
	RowLookup[] lookups;
	int[] slots;

	Table delta;
	Table prev;
	Table current;
	Table transitions;
	Table existed;

	public int size() {
		return pkeys.length;
	}

	public Table getFlattened() {
		return flattened;
	}

	public Object getPkey(int row) {
		return pkeys[row];
	}

	public Op getOp(int row) {
		return ops[row];
	}

	/**
	 * The key was deleted and then written again within the batch.
	 */
	public boolean isReset(int row) {
		return reset[row];
	}

	public RowLookup getLookup(int row) {
		return lookups[row];
	}

	public int getSlot(int row) {
		return slots[row];
	}

	ProcessState(Table flattened, Object[] pkeys, Op[] ops, boolean[] reset) {
		this.flattened = flattened;
		this.pkeys = pkeys;
		this.ops = ops;
		this.reset = reset;
		this.lookups = new RowLookup[pkeys.length];
		this.slots = new int[pkeys.length];
	}
}
