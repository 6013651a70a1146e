package org.conceptoriented.pivot.gnode;

import java.util.ArrayList;
import java.util.List;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;

/**
 * Queue of table fragments. Input ports accumulate fragments until the owner drains them; 
 * output ports hold the tables of the last processed batch.
 */
public class Port {

	private final int id;
	public int getId() {
		return id;
	}

	private final PortRole role;
	public PortRole getRole() {
		return role;
	}

	private Schema schema;
	public Schema getSchema() {
		return schema;
	}

	private final List<Table> fragments = new ArrayList<>();

	/**
	 * Number of queued rows.
	 */
	public int size() {
		return fragments.stream().mapToInt(Table::getSize).sum();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public void push(Table fragment) {
		if(!fragment.getSchema().equals(this.schema)) {
			throw new DcFault("Fragment schema " + fragment.getSchema() + " does not match port schema " + this.schema + ".");
		}
		fragments.add(fragment);
	}

	public int getFragmentCount() {
		return fragments.size();
	}

	/**
	 * Concatenate all queued fragments in arrival order and clear the queue. 
	 * A single fragment is returned as is. Queued fragments belong to their senders and are never released here.
	 */
	public Table drain() {
		Table table;
		if(fragments.size() == 1) {
			table = fragments.get(0);
		}
		else {
			table = Table.concat(role.name().toLowerCase() + "_" + id, this.schema, fragments);
		}
		fragments.clear();
		return table;
	}

	/**
	 * Table of an output port or null if nothing has been processed.
	 */
	public Table getTable() {
		return fragments.isEmpty() ? null : fragments.get(fragments.size() - 1);
	}

	/**
	 * Replace the table of an output port releasing the previous one.
	 */
	public void setTable(Table table) {
		clear();
		fragments.add(table);
	}

	public void clear() {
		if(role != PortRole.INPUT) {
			fragments.forEach(Table::release);
		}
		fragments.clear();
	}

	/**
	 * Widen a column of the schema and of all queued fragments.
	 */
	public void promoteColumn(String name, DType dtype) {
		this.schema.retype(name, dtype);
		for(Table t : fragments) {
			t.promoteColumn(name, dtype, t.getSize(), false);
		}
	}

	public void setSchema(Schema schema) {
		this.schema = schema.copy();
	}

	@Override
	public String toString() {
		return "[" + role + ":" + id + "]";
	}

	public Port(int id, PortRole role, Schema schema) {
		this.id = id;
		this.role = role;
		this.schema = schema.copy();
	}
}
