package org.conceptoriented.pivot.gnode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.Record;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.conceptoriented.pivot.core.Values;

/**
 * Authoritative current state: one live row per primary key. 
 * Slots of live keys never move; slots of deleted keys are recycled.
 */
public class GnodeState {

	private final Table table;
	public Table getTable() {
		return table;
	}

	private final Map<Object, Integer> mapping = new HashMap<>();
	private final Deque<Integer> free = new ArrayDeque<>();

	public int size() {
		return mapping.size();
	}

	// Keys are mapped in the form the key column returns them
	private Object key(Object pkey) {
		return Values.canonical(pkey, table.getColumn(Schema.PKEY).getDType());
	}

	public RowLookup lookup(Object pkey) {
		Integer idx = mapping.get(key(pkey));
		if(idx == null) return RowLookup.ABSENT;
		return new RowLookup(true, idx);
	}

	public boolean hasPkey(Object pkey) {
		return mapping.containsKey(key(pkey));
	}

	public boolean hasPkeys(Collection<?> pkeys) {
		return pkeys.stream().allMatch(this::hasPkey);
	}

	/**
	 * Live keys in key order.
	 */
	public List<Object> getPkeys() {
		List<Object> pkeys = new ArrayList<>(mapping.keySet());
		pkeys.sort(Values.ORDER);
		return pkeys;
	}

	/**
	 * Slots of all live rows.
	 */
	public List<Integer> getSlots() {
		return new ArrayList<>(mapping.values());
	}

	/**
	 * Slot for writing the row of the key: the current slot of a live key, otherwise a recycled or a new one.
	 * The key is mapped only when the row is committed.
	 */
	public int allocate(Object pkey) {
		Integer idx = mapping.get(pkey);
		if(idx != null) return idx;
		if(!free.isEmpty()) return free.pop();
		int slot = table.getSize();
		table.extend(1);
		return slot;
	}

	/**
	 * Write the cells of a row of the source table into the slot and map the key to it.
	 */
	public void upsert(Object pkey, int slot, Table source, int row) {
		Integer existing = mapping.get(pkey);
		if(existing != null && existing != slot) {
			throw new DcFault("Key " + pkey + " is live in slot " + existing + " and cannot be moved to slot " + slot + ".");
		}
		for(Column target : table.getColumns()) {
			if(Schema.PKEY.equals(target.getName()) || Schema.OKEY.equals(target.getName())) {
				target.setValue(slot, pkey);
				continue;
			}
			Column c = source.getColumn(target.getName());
			if(c == null) {
				throw new DcFault("Column '" + target.getName() + "' is missing in table " + source + ".");
			}
			target.copyCell(slot, c, row);
		}
		mapping.put(pkey, slot);
	}

	/**
	 * Remove the key and release the cells of its slot.
	 */
	public void tombstone(Object pkey) {
		Integer slot = mapping.remove(pkey);
		if(slot == null) {
			throw new DcFault("Key " + pkey + " is not live.");
		}
		for(Column c : table.getColumns()) {
			c.unset(slot);
		}
		free.push(slot);
	}

	public Object getValue(Object pkey, String column) {
		Integer slot = mapping.get(key(pkey));
		if(slot == null) return null;
		Column c = table.getColumn(column);
		if(c == null) {
			throw new DcFault("Column '" + column + "' not found in state.");
		}
		return c.getValue(slot);
	}

	public Record getRecord(Object pkey) {
		Integer slot = mapping.get(key(pkey));
		if(slot == null) return null;
		return table.getRecord(slot);
	}

	/**
	 * Table with the live rows in key order.
	 */
	public Table snapshot() {
		Table snapshot = new Table("snapshot", table.getSchema());
		List<Object> pkeys = getPkeys();
		snapshot.setSize(pkeys.size());
		List<Column> targets = snapshot.getColumns();
		List<Column> sources = table.getColumns();
		for(int row = 0; row < pkeys.size(); row++) {
			int slot = mapping.get(pkeys.get(row));
			for(int c = 0; c < sources.size(); c++) {
				targets.get(c).copyCell(row, sources.get(c), slot);
			}
		}
		return snapshot;
	}

	public void addColumn(String name, DType dtype) {
		table.addColumn(name, dtype);
	}

	public void promoteColumn(String name, DType dtype) {
		table.promoteColumn(name, dtype, table.getSize(), false);
	}

	public void reset() {
		table.release();
		mapping.clear();
		free.clear();
	}

	@Override
	public String toString() {
		return "[" + table.getName() + ": " + mapping.size() + " rows]";
	}

	public GnodeState(Schema schema) {
		this.table = new Table("gstate", schema);
	}
}
