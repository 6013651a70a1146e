package org.conceptoriented.pivot.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.json.JSONException;
import org.json.JSONTokener;

/**
 * Ordered list of column names with their types.
 */
public class Schema {

	//
	// Internal columns maintained by the engine
	//

	public static final String PKEY = "psp_pkey";
	public static final String OP = "psp_op";
	public static final String OKEY = "psp_okey";
	public static final String EXISTED = "psp_existed";

	public static boolean isInternal(String name) {
		return PKEY.equals(name) || OP.equals(name) || OKEY.equals(name) || EXISTED.equals(name);
	}

	private final Map<String, DType> columns = new LinkedHashMap<>();

	public List<String> getColumns() {
		return new ArrayList<>(columns.keySet());
	}

	public List<DType> getTypes() {
		return new ArrayList<>(columns.values());
	}

	public DType getType(String name) {
		return columns.get(name);
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	public int size() {
		return columns.size();
	}

	public Schema addColumn(String name, DType dtype) {
		if(columns.containsKey(name)) {
			throw new DcFault("Column '" + name + "' already exists in schema.");
		}
		columns.put(name, dtype);
		return this;
	}

	/**
	 * Change the type of an existing column keeping its position.
	 */
	public void retype(String name, DType dtype) {
		if(!columns.containsKey(name)) {
			throw new DcFault("Column '" + name + "' not found in schema.");
		}
		columns.put(name, dtype);
	}

	public Schema copy() {
		Schema schema = new Schema();
		schema.columns.putAll(this.columns);
		return schema;
	}

	/**
	 * Copy without the internal engine columns.
	 */
	public Schema withoutInternal() {
		Schema schema = new Schema();
		columns.forEach((n, t) -> {
			if(!isInternal(n)) schema.columns.put(n, t);
		});
		return schema;
	}

	/**
	 * Map of column name to canonical type name.
	 */
	public Map<String, String> toTypeNames() {
		Map<String, String> names = new LinkedHashMap<>();
		columns.forEach((n, t) -> names.put(n, t.getTypeName()));
		return names;
	}

	public String toJson() {
		String data = "";
		for(Map.Entry<String, DType> entry : columns.entrySet()) {
			data += "`" + entry.getKey() + "`:`" + entry.getValue().name().toLowerCase() + "`, ";
		}
		if(data.length() > 2) {
			data = data.substring(0, data.length()-2);
		}
		return ("{" + data + "}").replace('`', '"');
	}

	/**
	 * Parse an object mapping column names to type names, for example, <code>{"a":"integer","b":"string"}</code>.
	 * Keys are taken in document order.
	 */
	public static Schema fromJson(String json) throws DcError {
		Map<String, Object> obj;
		try {
			obj = Record.readObject(new JSONTokener(json));
		}
		catch(JSONException e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Cannot parse schema.", e.getMessage(), e);
		}

		Schema schema = new Schema();
		for(Map.Entry<String, Object> entry : obj.entrySet()) {
			schema.addColumn(entry.getKey(), DType.fromName(entry.getValue() == null ? null : entry.getValue().toString()));
		}
		return schema;
	}

	@Override
	public boolean equals(Object other) {
		if(other == this) return true;
		if(!(other instanceof Schema)) return false;
		// Order matters
		return new ArrayList<>(columns.entrySet()).equals(new ArrayList<>(((Schema)other).columns.entrySet()));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns(), getTypes());
	}

	@Override
	public String toString() {
		return columns.toString();
	}

	public Schema(List<String> names, List<DType> types) {
		if(names.size() != types.size()) {
			throw new DcFault("Number of column names and types differ.");
		}
		for(int i = 0; i < names.size(); i++) {
			addColumn(names.get(i), types.get(i));
		}
	}

	public Schema() {
	}
}
