package org.conceptoriented.pivot.gnode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Schema;

/**
 * Column derived row by row from other columns of the same row. 
 * Its values are recomputed only for rows whose inputs changed and then diffed like any other column.
 */
public class ComputedColumn {

	private final String name;
	public String getName() {
		return name;
	}

	private DType dtype;
	public DType getDType() {
		return dtype;
	}

	private final List<String> inputs;
	public List<String> getInputs() {
		return new ArrayList<>(inputs);
	}

	private ComputedFunction function;
	public ComputedFunction getFunction() {
		return function;
	}

	// Built-in computation resolved against the input types on bind
	private Computation.Method method;

	/**
	 * Check the inputs against the schema and resolve the output type.
	 */
	public void bind(Schema schema) throws DcError {
		for(String input : inputs) {
			if(!schema.hasColumn(input)) {
				throw new DcError(DcErrorCode.BIND_ERROR, "Bind error", "Cannot resolve column '" + input + "' of computed column '" + name + "'.");
			}
			if(function instanceof FormulaFunction && !schema.getType(input).isNumeric()) {
				throw new DcError(DcErrorCode.BIND_ERROR, "Bind error", "Formula of column '" + name + "' uses non-numeric column '" + input + "'.");
			}
		}

		if(method != null) {
			DType a = schema.getType(inputs.get(0));
			DType b = schema.getType(inputs.get(1));
			DType ret = Computation.getReturnType(method, a, b);
			if(ret == null) {
				throw new DcError(DcErrorCode.BIND_ERROR, "Bind error", "Computation " + method.getName() + " is not defined for types " + a + " and " + b + ".");
			}
			this.dtype = ret;
			this.function = Computation.getFunction(method, a, b);
		}
	}

	/**
	 * Invalid output if any of the arguments is invalid.
	 */
	public Object evaluate(Object[] args) {
		for(Object arg : args) {
			if(arg == null) return null;
		}
		return function.compute(args);
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	//
	// Creation
	//

	public static ComputedColumn of(String name, DType dtype, List<String> inputs, ComputedFunction function) {
		return new ComputedColumn(name, dtype, inputs, function);
	}

	/**
	 * Floating point column computed by an arithmetic formula with column references in square brackets.
	 */
	public static ComputedColumn formula(String name, String formula) throws DcError {
		FormulaFunction f = new FormulaFunction(formula);
		return new ComputedColumn(name, DType.FLOAT64, f.getParams(), f);
	}

	public static ComputedColumn computation(String name, Computation.Method method, String a, String b) {
		ComputedColumn column = new ComputedColumn(name, null, Arrays.asList(a, b), null);
		column.method = method;
		return column;
	}

	private ComputedColumn(String name, DType dtype, List<String> inputs, ComputedFunction function) {
		this.name = name;
		this.dtype = dtype;
		this.inputs = new ArrayList<>(inputs);
		this.function = function;
	}
}
