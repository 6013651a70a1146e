package org.conceptoriented.pivot.ingest;

import org.conceptoriented.pivot.core.EngineConfig;

/**
 * How rows of a dataset are keyed. With an index the value of the index column is the key. 
 * Otherwise rows get running numbers which wrap around at the limit, if one is set.
 */
public class DatasetOptions {

	private String name;
	public String getName() {
		return name;
	}
	public DatasetOptions setName(String name) {
		this.name = name;
		return this;
	}

	private String index;
	public String getIndex() {
		return index;
	}
	public DatasetOptions setIndex(String index) {
		this.index = index;
		return this;
	}

	// 0 means no limit
	private int limit;
	public int getLimit() {
		return limit;
	}
	public DatasetOptions setLimit(int limit) {
		this.limit = limit;
		return this;
	}

	private EngineConfig config;
	public EngineConfig getConfig() {
		return config != null ? config : EngineConfig.defaults();
	}
	public DatasetOptions setConfig(EngineConfig config) {
		this.config = config;
		return this;
	}

	@Override
	public String toString() {
		return "[index=" + index + ", limit=" + limit + "]";
	}

	public DatasetOptions() {
	}
}
