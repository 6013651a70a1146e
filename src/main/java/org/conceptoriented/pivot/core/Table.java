package org.conceptoriented.pivot.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Set of equally sized named columns.
 */
public class Table {
	private static final Logger LOG = Logger.getLogger(Table.class);

	private String name;
	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}

	private int size;
	public int getSize() {
		return size;
	}

	//
	// Columns
	//

	private final Map<String, Column> columns = new LinkedHashMap<>();

	public List<Column> getColumns() {
		return new ArrayList<>(columns.values());
	}

	public List<String> getColumnNames() {
		return new ArrayList<>(columns.keySet());
	}

	public Column getColumn(String name) {
		return columns.get(name);
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	public Schema getSchema() {
		Schema schema = new Schema();
		columns.values().forEach(c -> schema.addColumn(c.getName(), c.getDType()));
		return schema;
	}

	/**
	 * Add a column or return the existing one with the same name and type.
	 */
	public Column addColumn(String name, DType dtype) {
		Column column = columns.get(name);
		if(column != null) {
			if(column.getDType() != dtype) {
				throw new DcFault("Column '" + name + "' already exists with type " + column.getDType() + ".");
			}
			return column;
		}
		column = dtype.newColumn(name);
		column.setSize(this.size);
		columns.put(name, column);
		return column;
	}

	public Column addColumn(Column column) {
		if(columns.containsKey(column.getName())) {
			throw new DcFault("Column '" + column.getName() + "' already exists.");
		}
		column.setSize(this.size);
		columns.put(column.getName(), column);
		return column;
	}

	/**
	 * Add a deep copy of an existing column under a new name.
	 */
	public Column cloneColumn(String existing, String newName) {
		Column source = columns.get(existing);
		if(source == null) {
			throw new DcFault("Column '" + existing + "' not found.");
		}
		Column copy = source.copy(newName);
		Column old = columns.put(newName, copy);
		if(old != null) old.clear();
		return copy;
	}

	public void dropColumn(String name) {
		Column column = columns.remove(name);
		if(column != null) column.clear();
	}

	/**
	 * Replace the column by a column of a wider type. Cells of rows before <code>fromRow</code> are converted, 
	 * cells of rows starting from <code>fromRow</code> are either filled with the type default or left unset.
	 */
	public Column promoteColumn(String name, DType target, int fromRow, boolean fillDefault) {
		Column old = columns.get(name);
		if(old == null) {
			throw new DcFault("Column '" + name + "' not found.");
		}
		if(old.getDType() == target) {
			return old;
		}
		if(!old.getDType().canPromoteTo(target)) {
			throw new DcFault("Column '" + name + "' of type " + old.getDType() + " cannot be promoted to " + target + ".");
		}

		Column column = target.newColumn(name);
		column.setSize(this.size);
		int end = Math.min(fromRow, this.size);
		for(int row = 0; row < end; row++) {
			switch(old.getState(row)) {
			case VALID:
				column.setValue(row, convert(old.getValue(row), target));
				break;
			case NULL:
				column.setNull(row);
				break;
			default:
				break;
			}
		}
		if(fillDefault) {
			Object value = target.getDefaultValue();
			for(int row = end; row < this.size; row++) {
				column.setValue(row, value);
			}
		}

		columns.put(name, column); // Same key keeps the position
		old.clear();
		LOG.debugf("Column '%s' of table '%s' promoted from %s to %s", name, this.name, old.getDType(), target);
		return column;
	}

	private static Object convert(Object value, DType target) {
		if(target == DType.STR) return value.toString();
		if(target.isFloating()) return Values.toDouble(value);
		if(target.isIntegral()) return ((Number)value).longValue();
		return value;
	}

	//
	// Rows
	//

	public void setSize(int size) {
		columns.values().forEach(c -> c.setSize(size));
		this.size = size;
	}

	public void extend(int count) {
		setSize(this.size + count);
	}

	/**
	 * Drop all cells releasing their payloads.
	 */
	public void release() {
		setSize(0);
	}

	public Record getRecord(int row) {
		Record r = new Record();
		for(Column c : columns.values()) {
			r.set(c.getName(), c.getValue(row));
		}
		return r;
	}

	/**
	 * Append one row. Columns not mentioned in the record stay unset.
	 */
	public int appendRecord(Record record) {
		int row = this.size;
		extend(1);
		for(String n : record.getNames()) {
			Column c = columns.get(n);
			if(c == null) {
				throw new DcFault("Column '" + n + "' not found in table '" + this.name + "'.");
			}
			c.setValue(row, record.get(n));
		}
		return row;
	}

	/**
	 * Stack tables with the same schema into a new table. 
	 */
	public static Table concat(String name, Schema schema, List<Table> tables) {
		Table result = new Table(name, schema);
		int total = tables.stream().mapToInt(Table::getSize).sum();
		result.setSize(total);

		int offset = 0;
		for(Table t : tables) {
			for(String n : schema.getColumns()) {
				Column target = result.getColumn(n);
				Column source = t.getColumn(n);
				if(source == null) {
					throw new DcFault("Column '" + n + "' is missing in table '" + t.getName() + "'.");
				}
				for(int row = 0; row < t.getSize(); row++) {
					target.copyCell(offset + row, source, row);
				}
			}
			offset += t.getSize();
		}
		return result;
	}

	@Override
	public String toString() {
		return "[" + this.name + "]";
	}

	public String toDebugString() {
		String header = columns.keySet().stream().collect(Collectors.joining(", "));
		StringBuilder sb = new StringBuilder(this.name + " (" + header + ")\n");
		for(int row = 0; row < size; row++) {
			final int r = row;
			sb.append(columns.values().stream().map(c -> String.valueOf(c.getValue(r))).collect(Collectors.joining(", "))).append('\n');
		}
		return sb.toString();
	}

	public Table(String name, Schema schema) {
		this.name = name;
		for(String n : schema.getColumns()) {
			addColumn(n, schema.getType(n));
		}
	}

	public Table(String name) {
		this.name = name;
	}
}
