package org.conceptoriented.pivot.gnode;

import java.util.List;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.LongColumn;
import org.conceptoriented.pivot.core.Table;

/**
 * Evaluates a computed column. In a batch, only rows whose inputs changed are evaluated 
 * and other rows are left unset so that the diff keeps their stored values.
 */
final class ColumnEvaluator {

	private final ComputedColumn column;

	/**
	 * Write results into the flattened column for all rows affected by the batch.
	 * 
	 * @param current resolved current values of the batch (inputs have already been diffed)
	 * @param transitions transitions of the batch
	 * @return number of evaluated rows
	 */
	int evaluate(ProcessState ps, Table current, Table transitions, Column output) {
		List<String> inputs = column.getInputs();
		Column[] values = new Column[inputs.size()];
		LongColumn[] changes = new LongColumn[inputs.size()];
		for(int k = 0; k < inputs.size(); k++) {
			values[k] = current.getColumn(inputs.get(k));
			changes[k] = (LongColumn)transitions.getColumn(inputs.get(k));
			if(values[k] == null || changes[k] == null) {
				throw new DcFault("Input '" + inputs.get(k) + "' of computed column '" + column.getName() + "' has not been diffed.");
			}
		}

		Object[] args = new Object[inputs.size()];
		int count = 0;
		for(int i = 0; i < ps.size(); i++) {
			if(ps.ops[i] == Op.DELETE) continue;

			boolean affected = ps.reset[i] || !ps.lookups[i].exists();
			for(int k = 0; k < changes.length && !affected; k++) {
				affected = ValueTransition.fromValue(changes[k].getLong(i)).isChange();
			}
			if(!affected) continue;

			for(int k = 0; k < values.length; k++) {
				args[k] = values[k].getValue(i);
			}
			output.setValue(i, column.evaluate(args));
			count++;
		}
		return count;
	}

	/**
	 * Evaluate all rows of a table in place, for example, the state when the column is added.
	 */
	void evaluateAll(Table table, List<Integer> rows) {
		List<String> inputs = column.getInputs();
		Column output = table.getColumn(column.getName());
		Object[] args = new Object[inputs.size()];
		for(int row : rows) {
			for(int k = 0; k < inputs.size(); k++) {
				args[k] = table.getColumn(inputs.get(k)).getValue(row);
			}
			output.setValue(row, column.evaluate(args));
		}
	}

	ColumnEvaluator(ComputedColumn column) {
		this.column = column;
	}
}
