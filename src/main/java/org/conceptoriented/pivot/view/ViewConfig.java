package org.conceptoriented.pivot.view;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.tuple.Pair;
import org.conceptoriented.pivot.context.Filter;
import org.conceptoriented.pivot.context.FilterOp;
import org.conceptoriented.pivot.context.FilterTerm;
import org.conceptoriented.pivot.context.SortOrder;
import org.conceptoriented.pivot.context.SortSpec;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Description of a view: pivots, displayed columns with their aggregates, filter, sort and expansion depth. 
 * Columns referenced only by sort specs are aggregated as hidden columns.
 */
public class ViewConfig {

	private List<String> rowPivots = new ArrayList<>();
	public List<String> getRowPivots() {
		return Collections.unmodifiableList(rowPivots);
	}
	public ViewConfig setRowPivots(String... columns) {
		this.rowPivots = new ArrayList<>(Arrays.asList(columns));
		return this;
	}

	private List<String> columnPivots = new ArrayList<>();
	public List<String> getColumnPivots() {
		return Collections.unmodifiableList(columnPivots);
	}
	public ViewConfig setColumnPivots(String... columns) {
		this.columnPivots = new ArrayList<>(Arrays.asList(columns));
		return this;
	}

	// Null means all columns of the data schema
	private List<String> columns;
	public List<String> getColumns() {
		return columns == null ? null : Collections.unmodifiableList(columns);
	}
	public ViewConfig setColumns(String... columns) {
		this.columns = new ArrayList<>(Arrays.asList(columns));
		return this;
	}

	// Column -> aggregate name and optional weight column
	private final Map<String, Pair<String, String>> aggregates = new LinkedHashMap<>();
	public Map<String, Pair<String, String>> getAggregates() {
		return Collections.unmodifiableMap(aggregates);
	}
	public ViewConfig setAggregate(String column, String aggregate) {
		aggregates.put(column, Pair.of(aggregate, null));
		return this;
	}
	public ViewConfig setWeightedMean(String column, String weight) {
		aggregates.put(column, Pair.of("weighted mean", weight));
		return this;
	}

	private final List<FilterTerm> filters = new ArrayList<>();
	public List<FilterTerm> getFilters() {
		return Collections.unmodifiableList(filters);
	}
	public ViewConfig addFilter(String column, FilterOp op, Object operand) {
		filters.add(new FilterTerm(column, op, operand));
		return this;
	}

	private Filter.Combinator filterOp = Filter.Combinator.AND;
	public Filter.Combinator getFilterOp() {
		return filterOp;
	}
	public ViewConfig setFilterOp(Filter.Combinator filterOp) {
		this.filterOp = filterOp;
		return this;
	}

	private final List<SortSpec> sorts = new ArrayList<>();
	public List<SortSpec> getSorts() {
		return Collections.unmodifiableList(sorts);
	}
	public ViewConfig addSort(String column, SortOrder order) {
		sorts.add(new SortSpec(column, order));
		return this;
	}

	// Null means the engine default
	private Integer rowExpandDepth;
	public Integer getRowExpandDepth() {
		return rowExpandDepth;
	}
	public ViewConfig setRowExpandDepth(Integer depth) {
		this.rowExpandDepth = depth;
		return this;
	}

	private Integer columnExpandDepth;
	public Integer getColumnExpandDepth() {
		return columnExpandDepth;
	}
	public ViewConfig setColumnExpandDepth(Integer depth) {
		this.columnExpandDepth = depth;
		return this;
	}

	/**
	 * Only column pivots. Rows are then pivoted by the primary key and the total row is hidden.
	 */
	public boolean isColumnOnly() {
		return rowPivots.isEmpty() && !columnPivots.isEmpty();
	}

	public int getSides() {
		if(!columnPivots.isEmpty()) return 2;
		if(!rowPivots.isEmpty()) return 1;
		return 0;
	}

	public ViewConfig copy() {
		ViewConfig c = new ViewConfig();
		c.rowPivots = new ArrayList<>(rowPivots);
		c.columnPivots = new ArrayList<>(columnPivots);
		c.columns = columns == null ? null : new ArrayList<>(columns);
		c.aggregates.putAll(aggregates);
		c.filters.addAll(filters);
		c.filterOp = filterOp;
		c.sorts.addAll(sorts);
		c.rowExpandDepth = rowExpandDepth;
		c.columnExpandDepth = columnExpandDepth;
		return c;
	}

	//
	// Serialization
	//

	/**
	 * Parse a view description like 
	 * {"row_pivots":["a"], "column_pivots":["b"], "columns":["x","y"], "aggregates":{"x":"sum","y":["weighted mean","x"]}, 
	 * "filter":[["x",">",10]], "filter_op":"and", "sort":[["x","desc"]]}
	 */
	public static ViewConfig fromJson(String json) throws DcError {
		ViewConfig config = new ViewConfig();
		try {
			JSONObject obj = new JSONObject(json);

			config.rowPivots = toStrings(obj.optJSONArray("row_pivots"));
			config.columnPivots = toStrings(obj.optJSONArray("column_pivots"));
			if(obj.has("columns")) {
				config.columns = toStrings(obj.getJSONArray("columns"));
			}

			JSONObject aggs = obj.optJSONObject("aggregates");
			if(aggs != null) {
				for(String column : aggs.keySet()) {
					Object agg = aggs.get(column);
					if(agg instanceof JSONArray) {
						JSONArray a = (JSONArray)agg;
						config.aggregates.put(column, Pair.of(a.getString(0), a.length() > 1 ? a.getString(1) : null));
					}
					else {
						config.aggregates.put(column, Pair.of(agg.toString(), null));
					}
				}
			}

			JSONArray filters = obj.optJSONArray("filter");
			if(filters != null) {
				for(int i = 0; i < filters.length(); i++) {
					JSONArray f = filters.getJSONArray(i);
					FilterOp op = FilterOp.fromSymbol(f.getString(1));
					Object operand = null;
					if(f.length() > 2 && !f.isNull(2)) {
						Object o = f.get(2);
						operand = o instanceof JSONArray ? ((JSONArray)o).toList() : o;
					}
					config.filters.add(new FilterTerm(f.getString(0), op, normalize(operand)));
				}
			}

			if(obj.has("filter_op")) {
				String op = obj.getString("filter_op");
				try {
					config.filterOp = Filter.Combinator.valueOf(op.trim().toUpperCase());
				}
				catch(IllegalArgumentException e) {
					throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid view configuration.", "Unknown filter operator '" + op + "'.", e);
				}
			}

			JSONArray sorts = obj.optJSONArray("sort");
			if(sorts != null) {
				for(int i = 0; i < sorts.length(); i++) {
					JSONArray s = sorts.getJSONArray(i);
					config.sorts.add(new SortSpec(s.getString(0), SortOrder.fromName(s.getString(1))));
				}
			}

			if(obj.has("row_expand_depth")) {
				config.rowExpandDepth = obj.getInt("row_expand_depth");
			}
			if(obj.has("column_expand_depth")) {
				config.columnExpandDepth = obj.getInt("column_expand_depth");
			}
		}
		catch(JSONException e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Cannot parse view configuration.", e.getMessage(), e);
		}
		return config;
	}

	private static List<String> toStrings(JSONArray array) {
		List<String> list = new ArrayList<>();
		if(array == null) return list;
		for(int i = 0; i < array.length(); i++) {
			list.add(array.getString(i));
		}
		return list;
	}

	// JSON numbers come as Integer, BigDecimal etc.
	private static Object normalize(Object operand) {
		if(operand instanceof List) {
			List<Object> values = new ArrayList<>();
			for(Object o : (List<?>)operand) values.add(normalize(o));
			return values;
		}
		if(operand instanceof Integer || operand instanceof Long) return ((Number)operand).longValue();
		if(operand instanceof Number) return ((Number)operand).doubleValue();
		return operand;
	}

	@Override
	public String toString() {
		return "[rows=" + rowPivots + ", columns=" + columnPivots + ", sort=" + sorts + "]";
	}

	public ViewConfig() {
	}
}
