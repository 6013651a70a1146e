package org.conceptoriented.pivot.gnode;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.LongColumn;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;

/**
 * Read-only view of one processed batch passed to contexts. All tables have one row per flattened row. 
 * It must not be retained after the notification returns.
 */
public class NotifyFrame {

	private final ProcessState ps;

	public int size() {
		return ps.size();
	}

	public Table getFlattened() {
		return ps.flattened;
	}

	public Table getDelta() {
		return ps.delta;
	}

	public Table getPrev() {
		return ps.prev;
	}

	public Table getCurrent() {
		return ps.current;
	}

	public Table getTransitions() {
		return ps.transitions;
	}

	public Table getExisted() {
		return ps.existed;
	}

	public Object getPkey(int row) {
		return ps.pkeys[row];
	}

	public Op getOp(int row) {
		return ps.ops[row];
	}

	public boolean isReset(int row) {
		return ps.reset[row];
	}

	/**
	 * The key was live before the batch.
	 */
	public boolean rowPreExisted(int row) {
		return ps.lookups[row].exists();
	}

	/**
	 * False only for a delete of a key that never existed.
	 */
	public boolean existed(int row) {
		return ((LongColumn)ps.existed.getColumn(Schema.EXISTED)).getLong(row) != 0;
	}

	/**
	 * The key is live after the batch.
	 */
	public boolean existsNow(int row) {
		return ps.ops[row] != Op.DELETE;
	}

	public ValueTransition getTransition(String column, int row) {
		Column c = ps.transitions.getColumn(column);
		if(c == null) {
			throw new DcFault("No transitions for column '" + column + "'.");
		}
		return ValueTransition.fromValue(((LongColumn)c).getLong(row));
	}

	NotifyFrame(ProcessState ps) {
		this.ps = ps;
	}
}
