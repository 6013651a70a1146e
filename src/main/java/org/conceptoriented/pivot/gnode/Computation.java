package org.conceptoriented.pivot.gnode;

import java.util.Map;

import org.apache.commons.lang3.tuple.Triple;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.Values;

import com.google.common.collect.ImmutableMap;

/**
 * Built-in binary computations over numeric columns.
 */
public final class Computation {

	public enum Method {
		ADD("add"),
		SUBTRACT("subtract"),
		MULTIPLY("multiply"),
		DIVIDE("divide"),
		;

		private final String name;
		public String getName() {
			return name;
		}

		public static Method fromName(String name) {
			for(Method m : values()) {
				if(m.name.equalsIgnoreCase(name)) return m;
			}
			return null;
		}

		private Method(String name) {
			this.name = name;
		}
	}

	// Built on first use
	private static final class ReturnTypes {
		static final Map<Triple<Method, DType, DType>, DType> TABLE = build();

		private static Map<Triple<Method, DType, DType>, DType> build() {
			ImmutableMap.Builder<Triple<Method, DType, DType>, DType> builder = ImmutableMap.builder();
			for(Method m : Method.values()) {
				for(DType a : DType.values()) {
					if(!a.isNumeric()) continue;
					for(DType b : DType.values()) {
						if(!b.isNumeric()) continue;
						DType r = (m != Method.DIVIDE && a.isIntegral() && b.isIntegral()) ? DType.INT64 : DType.FLOAT64;
						builder.put(Triple.of(m, a, b), r);
					}
				}
			}
			return builder.build();
		}
	}

	/**
	 * Return type of the method for the argument types or null if the method is not defined for them.
	 */
	public static DType getReturnType(Method method, DType a, DType b) {
		return ReturnTypes.TABLE.get(Triple.of(method, a, b));
	}

	public static ComputedFunction getFunction(Method method, DType a, DType b) {
		DType ret = getReturnType(method, a, b);
		if(ret == null) {
			throw new DcFault("No computation " + method.getName() + " for types " + a + " and " + b + ".");
		}

		if(ret == DType.INT64) {
			switch(method) {
			case ADD: return args -> ((Number)args[0]).longValue() + ((Number)args[1]).longValue();
			case SUBTRACT: return args -> ((Number)args[0]).longValue() - ((Number)args[1]).longValue();
			case MULTIPLY: return args -> ((Number)args[0]).longValue() * ((Number)args[1]).longValue();
			default: break;
			}
		}
		switch(method) {
		case ADD: return args -> Values.toDouble(args[0]) + Values.toDouble(args[1]);
		case SUBTRACT: return args -> Values.toDouble(args[0]) - Values.toDouble(args[1]);
		case MULTIPLY: return args -> Values.toDouble(args[0]) * Values.toDouble(args[1]);
		case DIVIDE: return args -> {
			double d = Values.toDouble(args[1]);
			if(d == 0.0) return null;
			return Values.toDouble(args[0]) / d;
		};
		default: throw new DcFault("Unknown computation " + method + ".");
		}
	}

	private Computation() {
	}
}
