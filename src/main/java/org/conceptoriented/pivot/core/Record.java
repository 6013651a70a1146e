package org.conceptoriented.pivot.core;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * One input row as a map of column names to values. A name mapped to null is an explicit null 
 * while a missing name means that the cell is not written.
 */
public class Record {
	
	private final Map<String, Object> record = new LinkedHashMap<>();

	public Object get(String name) {
		return record.get(name);
	}

	public boolean has(String name) {
		return record.containsKey(name);
	}

	public Record set(String name, Object value) {
		record.put(name, value);
		return this;
	}

	public void remove(String name) {
		record.remove(name);
	}

	public Set<String> getNames() {
		return record.keySet();
	}

	public Map<String, Object> toMap() {
		return new LinkedHashMap<>(record);
	}

	public static Record of(Object... pairs) {
		if(pairs.length % 2 != 0) {
			throw new IllegalArgumentException("Names and values have to be specified in pairs.");
		}
		Record r = new Record();
		for(int i = 0; i < pairs.length; i += 2) {
			r.set((String)pairs[i], pairs[i+1]);
		}
		return r;
	}

	public String toJson() {
		String data = "";
		for (Map.Entry<String, Object> entry : record.entrySet())
		{
			Object value = entry.getValue();
			String data_elem = "`" + entry.getKey() + "`:" + JSONObject.valueToString(value == null ? null : (value instanceof Number || value instanceof Boolean ? value : value.toString())).replace('"', '`') + ", ";
			data += data_elem;
		}		
		if(data.length() > 2) {
			data = data.substring(0, data.length()-2);
		}
		
		return ("{" + data + "}").replace('`', '"'); // Backticks avoid escaping double quotes
	}

	@Override
	public String toString() {
		return record.toString();
	}

	@Override
	public boolean equals(Object other) {
		if(other == this) return true;
		if(!(other instanceof Record)) return false;
		return record.equals(((Record)other).record);
	}

	@Override
	public int hashCode() {
		return record.hashCode();
	}

	//
	// JSON
	//

	public static Record fromJson(String json) throws DcError {
		List<Record> records = fromJsonList(json);
		if(records.size() != 1) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Expected one record.", "Found " + records.size() + " records.");
		}
		return records.get(0);
	}

	/**
	 * Parse either an array of objects or a single object. Column order follows the document.
	 */
	public static List<Record> fromJsonList(String json) throws DcError {
		List<Record> records = new ArrayList<>();
		try {
			JSONTokener x = new JSONTokener(json);
			char c = x.nextClean();
			if(c == '{') {
				x.back();
				records.add(fromMap(readObject(x)));
				return records;
			}
			if(c != '[') {
				throw x.syntaxError("A JSON array or object is expected");
			}
			c = x.nextClean();
			if(c == ']') return records;
			x.back();
			while(true) {
				records.add(fromMap(readObject(x)));
				c = x.nextClean();
				if(c == ']') break;
				if(c != ',') throw x.syntaxError("Expected a ',' or ']'");
			}
		}
		catch(JSONException e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Cannot parse JSON records.", e.getMessage(), e);
		}
		return records;
	}

	/**
	 * Read one JSON object preserving key order. JSON nulls are returned as Java nulls.
	 */
	public static Map<String, Object> readObject(JSONTokener x) {
		Map<String, Object> map = new LinkedHashMap<>();
		if(x.nextClean() != '{') {
			throw x.syntaxError("A JSON object text must begin with '{'");
		}
		char c = x.nextClean();
		if(c == '}') return map;
		x.back();
		while(true) {
			String key = x.nextValue().toString();
			if(x.nextClean() != ':') {
				throw x.syntaxError("Expected a ':' after a key");
			}
			Object value = x.nextValue();
			map.put(key, JSONObject.NULL.equals(value) ? null : value);

			c = x.nextClean();
			if(c == '}') break;
			if(c != ',') throw x.syntaxError("Expected a ',' or '}'");
		}
		return map;
	}

	private static Record fromMap(Map<String, Object> map) {
		Record r = new Record();
		r.record.putAll(map);
		return r;
	}

	//
	// CSV
	//

	/**
	 * Parse CSV text with a header line. Empty fields are explicit nulls. Values are strings.
	 */
	public static List<Record> fromCsvList(String csv) throws DcError {
		List<Record> records = new ArrayList<>();
		CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setIgnoreSurroundingSpaces(true).build();
		try (CSVParser parser = CSVParser.parse(new StringReader(csv), format)) {
			List<String> columns = parser.getHeaderNames();
			for(CSVRecord line : parser) {
				Record r = new Record();
				for(int j = 0; j < columns.size() && j < line.size(); j++) {
					String value = line.get(j);
					r.set(columns.get(j), value == null || value.isEmpty() ? null : value);
				}
				records.add(r);
			}
		}
		catch(IOException | IllegalArgumentException | IllegalStateException e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Cannot parse CSV records.", e.getMessage(), e);
		}
		return records;
	}

	public Record() {
	}
}
