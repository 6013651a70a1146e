package org.conceptoriented.pivot.gnode;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.DoubleColumn;
import org.conceptoriented.pivot.core.LongColumn;

/**
 * Diff of one column of the flattened batch against the stored state. 
 * It writes only the output columns of its own column so that different columns can be processed concurrently.
 */
final class ColumnDiff {

	private final String name;

	private final Column incoming;
	private final Column stored;

	private final Column delta;
	private final Column prev;
	private final Column current;
	private final LongColumn transitions;

	private final boolean numeric;

	void diff(ProcessState ps) {
		for(int i = 0; i < ps.size(); i++) {
			RowLookup lookup = ps.lookups[i];
			boolean rowPreExisted = lookup.exists();
			int slot = lookup.getIndex();

			switch(ps.ops[i]) {
			case INSERT:
			case UPDATE:
			case CLEAR: {
				boolean reset = ps.reset[i];
				boolean prevValid = rowPreExisted && stored.isValid(slot);

				// Previous value
				if(prevValid) prev.copyCell(i, stored, slot);
				else prev.setNull(i);

				// Current value: incoming cell if written, otherwise the stored one (partial update)
				if(incoming.isSet(i)) {
					current.copyCell(i, incoming, i);
				}
				else if(rowPreExisted && !reset) {
					current.copyCell(i, stored, slot);
				}
				else {
					current.setNull(i);
				}
				boolean curValid = current.isValid(i);

				boolean equal = prevValid && curValid && prev.cellEquals(i, current, i);
				ValueTransition t = ValueTransition.calc(rowPreExisted, reset, prevValid, curValid, equal);
				transitions.setLong(i, t.ordinal());

				if(numeric) {
					if(curValid || prevValid) setDelta(i, curValid, prevValid);
					else delta.setNull(i);
				}
				break;
			}
			case DELETE: {
				if(rowPreExisted) {
					boolean prevValid = stored.isValid(slot);
					if(prevValid) {
						prev.copyCell(i, stored, slot);
						current.copyCell(i, stored, slot);
					}
					else {
						prev.setNull(i);
						current.setNull(i);
					}
					transitions.setLong(i, ValueTransition.calcDelete(prevValid).ordinal());
					if(numeric) {
						if(prevValid) setDelta(i, false, true);
						else delta.setNull(i);
					}
				}
				else {
					prev.setNull(i);
					current.setNull(i);
					delta.setNull(i);
					transitions.setLong(i, ValueTransition.EQ_FF.ordinal());
				}
				break;
			}
			default:
				throw new DcFault("Unknown OP");
			}
		}
	}

	// Signed difference of current and previous where an invalid side counts as zero. 
	// A difference which does not fit into a long is left null.
	private void setDelta(int i, boolean curValid, boolean prevValid) {
		if(delta instanceof LongColumn) {
			long c = curValid ? ((LongColumn)current).getLong(i) : 0L;
			long p = prevValid ? ((LongColumn)prev).getLong(i) : 0L;
			try {
				((LongColumn)delta).setLong(i, Math.subtractExact(c, p));
			}
			catch(ArithmeticException e) {
				delta.setNull(i);
			}
		}
		else {
			double c = curValid ? ((DoubleColumn)current).getDouble(i) : 0.0;
			double p = prevValid ? ((DoubleColumn)prev).getDouble(i) : 0.0;
			((DoubleColumn)delta).setDouble(i, c - p);
		}
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	ColumnDiff(String name, Column incoming, Column stored, Column delta, Column prev, Column current, LongColumn transitions) {
		if(incoming.getDType() != stored.getDType()) {
			throw new DcFault("Column '" + name + "' has type " + incoming.getDType() + " in the batch but " + stored.getDType() + " in the state.");
		}
		this.name = name;
		this.incoming = incoming;
		this.stored = stored;
		this.delta = delta;
		this.prev = prev;
		this.current = current;
		this.transitions = transitions;
		this.numeric = stored.getDType().isNumeric();
	}
}
