package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named aggregate of one column (two for weighted mean).
 */
public final class AggSpec {

	private final String name;
	public String getName() {
		return name;
	}

	private final AggType type;
	public AggType getType() {
		return type;
	}

	private final String column;
	public String getColumn() {
		return column;
	}

	// Only for weighted mean
	private final String weight;
	public String getWeight() {
		return weight;
	}

	public List<String> getDependencies() {
		List<String> deps = new ArrayList<>();
		deps.add(column);
		if(weight != null) deps.add(weight);
		return deps;
	}

	@Override
	public boolean equals(Object other) {
		if(other == this) return true;
		if(!(other instanceof AggSpec)) return false;
		AggSpec o = (AggSpec)other;
		return name.equals(o.name) && type == o.type && column.equals(o.column) && Objects.equals(weight, o.weight);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, column, weight);
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	public AggSpec(String name, AggType type, String column, String weight) {
		this.name = name;
		this.type = type;
		this.column = column;
		this.weight = weight;
	}

	public AggSpec(String name, AggType type, String column) {
		this(name, type, column, null);
	}
}
