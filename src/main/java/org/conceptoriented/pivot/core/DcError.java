package org.conceptoriented.pivot.core;

import org.json.JSONObject;

/**
 * Recoverable error reported to the caller. It is raised before any state is mutated so the engine remains usable.
 */
public class DcError extends Exception {
	private static final long serialVersionUID = 1L;

	public DcErrorCode code;
	public String message;
	public String description;
	
	public String toJson() {
		String jcode = "`code`:" + this.code.getValue() + "";
		String jmessage = "`message`: " + JSONObject.valueToString(this.message) + "";
		String jdescription = "`description`: " + JSONObject.valueToString(this.description) + "";

		String json = jcode + ", " + jmessage + ", " + jdescription;

		return ("{" + json + "}").replace('`', '"');
	}

	@Override
	public String getMessage() {
		if(this.description == null || this.description.isEmpty()) return this.message;
		return this.message + " " + this.description;
	}

	@Override
	public String toString() {
		return "[" + this.code + "]: " + this.message;
	}
	
	public DcError(DcErrorCode code, String message, String description) {
		this.code = code;
		this.message = message;
		this.description = description;
	}

	public DcError(DcErrorCode code, String message, String description, Throwable cause) {
		super(cause);
		this.code = code;
		this.message = message;
		this.description = description;
	}
}
