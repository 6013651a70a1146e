package org.conceptoriented.pivot.gnode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.LongColumn;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;

/**
 * Collapses a drained batch to one row per primary key. 
 * <p>
 * Rows of a key are processed in arrival order. Everything before the last DELETE is discarded. 
 * The remaining rows are merged cell by cell: a later written cell wins and CLEAR sets all value cells to null.
 */
final class Flattener {

	static ProcessState flatten(Table batch) {
		Column pkeyColumn = batch.getColumn(Schema.PKEY);
		Column opColumn = batch.getColumn(Schema.OP);
		if(pkeyColumn == null || !(opColumn instanceof LongColumn)) {
			throw new DcFault("Batch " + batch + " has no key or operation column.");
		}
		LongColumn opc = (LongColumn)opColumn;

		// Group rows by key in the order of first appearance
		Map<Object, List<Integer>> groups = new LinkedHashMap<>();
		for(int row = 0; row < batch.getSize(); row++) {
			if(!opc.isValid(row) || Op.fromValue(opc.getLong(row)) == null) {
				throw new DcFault("Unknown OP");
			}
			groups.computeIfAbsent(pkeyColumn.getValue(row), k -> new ArrayList<>()).add(row);
		}

		int size = groups.size();
		Table flattened = new Table("flattened", batch.getSchema());
		flattened.setSize(size);

		Object[] pkeys = new Object[size];
		Op[] ops = new Op[size];
		boolean[] reset = new boolean[size];

		List<Column> columns = batch.getColumns();
		int i = 0;
		for(Map.Entry<Object, List<Integer>> group : groups.entrySet()) {
			List<Integer> rows = group.getValue();
			pkeys[i] = group.getKey();

			int lastDelete = -1;
			boolean written = false;
			for(int k = 0; k < rows.size(); k++) {
				if(Op.fromValue(opc.getLong(rows.get(k))) == Op.DELETE) lastDelete = k;
				else if(Op.fromValue(opc.getLong(rows.get(k))) == Op.INSERT) written = true;
			}

			Op op;
			if(lastDelete == rows.size() - 1) {
				op = Op.DELETE;
			}
			else if(lastDelete >= 0) {
				op = Op.INSERT;
				reset[i] = true;
			}
			else {
				op = written ? Op.INSERT : Op.UPDATE;
			}
			ops[i] = op;

			for(Column c : columns) {
				Column target = flattened.getColumn(c.getName());
				if(Schema.PKEY.equals(c.getName())) {
					target.copyCell(i, c, rows.get(rows.size() - 1));
					continue;
				}
				if(Schema.OP.equals(c.getName())) {
					((LongColumn)target).setLong(i, op.getValue());
					continue;
				}
				if(op == Op.DELETE) continue;

				// Last written cell after the last delete
				for(int k = rows.size() - 1; k > lastDelete; k--) {
					int row = rows.get(k);
					if(Op.fromValue(opc.getLong(row)) == Op.CLEAR) {
						target.setNull(i);
						break;
					}
					if(c.isSet(row)) {
						target.copyCell(i, c, row);
						break;
					}
				}
			}
			i++;
		}

		flattened.cloneColumn(Schema.PKEY, Schema.OKEY);
		return new ProcessState(flattened, pkeys, ops, reset);
	}

	private Flattener() {
	}
}
