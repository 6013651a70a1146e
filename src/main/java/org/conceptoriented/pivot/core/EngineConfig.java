package org.conceptoriented.pivot.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.jboss.logging.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Engine-wide settings. Defaults are read from the classpath resource <code>pivot-engine.json</code> 
 * and can be overridden by a JSON object with the same keys.
 */
public class EngineConfig {
	private static final Logger LOG = Logger.getLogger(EngineConfig.class);

	public static final String RESOURCE = "/pivot-engine.json";

	// Joins pivot values in column names
	private String separator = "|";
	public String getSeparator() {
		return separator;
	}
	public EngineConfig setSeparator(String separator) {
		this.separator = separator;
		return this;
	}

	// Number of threads used to diff columns. 1 means sequential processing.
	private int diffParallelism = 1;
	public int getDiffParallelism() {
		return diffParallelism;
	}
	public EngineConfig setDiffParallelism(int diffParallelism) {
		this.diffParallelism = diffParallelism;
		return this;
	}

	private FaultPolicy faultPolicy = FaultPolicy.REPORT;
	public FaultPolicy getFaultPolicy() {
		return faultPolicy;
	}
	public EngineConfig setFaultPolicy(FaultPolicy faultPolicy) {
		this.faultPolicy = faultPolicy;
		return this;
	}

	// Initial expansion depth of pivoted views. Negative means fully expanded.
	private int defaultExpandDepth = -1;
	public int getDefaultExpandDepth() {
		return defaultExpandDepth;
	}
	public EngineConfig setDefaultExpandDepth(int defaultExpandDepth) {
		this.defaultExpandDepth = defaultExpandDepth;
		return this;
	}

	public EngineConfig copy() {
		EngineConfig c = new EngineConfig();
		c.separator = this.separator;
		c.diffParallelism = this.diffParallelism;
		c.faultPolicy = this.faultPolicy;
		c.defaultExpandDepth = this.defaultExpandDepth;
		return c;
	}

	//
	// Serialization
	//

	public String toJson() {
		String json = "`separator`:" + JSONObject.quote(separator).replace('"', '`')
				+ ", `diffParallelism`:" + diffParallelism
				+ ", `faultPolicy`:`" + faultPolicy.name().toLowerCase() + "`"
				+ ", `defaultExpandDepth`:" + defaultExpandDepth;
		return ("{" + json + "}").replace('`', '"');
	}

	/**
	 * Overwrite the settings present in the JSON object. Unknown keys are ignored.
	 */
	public EngineConfig merge(JSONObject obj) throws DcError {
		try {
			if(obj.has("separator")) {
				this.separator = obj.getString("separator");
			}
			if(obj.has("diffParallelism")) {
				this.diffParallelism = obj.getInt("diffParallelism");
				if(this.diffParallelism < 1) {
					throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid configuration.", "diffParallelism has to be positive.");
				}
			}
			if(obj.has("faultPolicy")) {
				String policy = obj.getString("faultPolicy");
				try {
					this.faultPolicy = FaultPolicy.valueOf(policy.trim().toUpperCase());
				}
				catch(IllegalArgumentException e) {
					throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid configuration.", "Unknown fault policy '" + policy + "'.", e);
				}
			}
			if(obj.has("defaultExpandDepth")) {
				this.defaultExpandDepth = obj.getInt("defaultExpandDepth");
			}
		}
		catch(JSONException e) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid configuration.", e.getMessage(), e);
		}
		return this;
	}

	public static EngineConfig fromJson(String json) throws DcError {
		JSONObject obj;
		try {
			obj = new JSONObject(json);
		}
		catch(JSONException e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Cannot parse configuration.", e.getMessage(), e);
		}
		return defaults().merge(obj);
	}

	private static volatile EngineConfig defaults;

	/**
	 * Configuration loaded from the classpath resource. Built-in values are used if the resource is missing.
	 */
	public static EngineConfig defaults() {
		EngineConfig d = defaults;
		if(d == null) {
			d = load();
			defaults = d;
		}
		return d.copy();
	}

	private static EngineConfig load() {
		EngineConfig config = new EngineConfig();
		InputStream in = EngineConfig.class.getResourceAsStream(RESOURCE);
		if(in == null) {
			LOG.debugf("Resource %s not found. Using built-in defaults.", RESOURCE);
			return config;
		}
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			config.merge(new JSONObject(new JSONTokener(reader)));
		}
		catch(IOException | JSONException e) {
			throw new DcFault("Cannot read " + RESOURCE + ".", e);
		}
		catch(DcError e) {
			throw new DcFault("Invalid " + RESOURCE + ": " + e.getMessage(), e);
		}
		return config;
	}

	@Override
	public String toString() {
		return toJson();
	}

	public EngineConfig() {
	}
}
