package org.conceptoriented.pivot.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.conceptoriented.pivot.core.Range;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Rectangular window of view data in row-major order together with the paths of its rows.
 */
public class DataSlice {

	public static final String ROW_PATH = "__ROW_PATH__";

	private final Range rows;
	public Range getRows() {
		return rows;
	}
	public int getRowCount() {
		return rows.getLength();
	}

	private final List<String> columnNames;
	public List<String> getColumnNames() {
		return columnNames;
	}
	public int getColumnCount() {
		return columnNames.size();
	}

	private final List<List<Object>> rowPaths;
	public List<Object> getRowPath(int row) {
		return rowPaths.get(row);
	}

	private final List<Object> values;
	public List<Object> getValues() {
		return values;
	}

	/**
	 * Value at the position relative to the slice.
	 */
	public Object get(int row, int column) {
		return values.get(row * columnNames.size() + column);
	}

	public List<Object> getColumn(String name) {
		int c = columnNames.indexOf(name);
		if(c < 0) return null;
		List<Object> column = new ArrayList<>();
		for(int r = 0; r < getRowCount(); r++) {
			column.add(get(r, c));
		}
		return column;
	}

	/**
	 * Array of row objects. Pivoted slices carry the row path under __ROW_PATH__.
	 */
	public String toJson(boolean withRowPath) {
		JSONArray array = new JSONArray();
		for(int r = 0; r < getRowCount(); r++) {
			JSONObject obj = new JSONObject();
			if(withRowPath) {
				JSONArray path = new JSONArray();
				rowPaths.get(r).forEach(v -> path.put(toJsonValue(v)));
				obj.put(ROW_PATH, path);
			}
			for(int c = 0; c < columnNames.size(); c++) {
				obj.put(columnNames.get(c), toJsonValue(get(r, c)));
			}
			array.put(obj);
		}
		return array.toString();
	}

	private static Object toJsonValue(Object value) {
		if(value == null) return JSONObject.NULL;
		if(value instanceof Number || value instanceof Boolean || value instanceof String) return value;
		return value.toString();
	}

	@Override
	public String toString() {
		return "[rows " + rows + ", columns " + columnNames + "]";
	}

	public DataSlice(Range rows, List<String> columnNames, List<List<Object>> rowPaths, List<Object> values) {
		this.rows = rows;
		this.columnNames = Collections.unmodifiableList(columnNames);
		this.rowPaths = Collections.unmodifiableList(rowPaths);
		this.values = Collections.unmodifiableList(values);
	}
}
