package org.conceptoriented.pivot.gnode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Values;
import org.jboss.logging.Logger;

import net.objecthunter.exp4j.Expression;
import net.objecthunter.exp4j.ExpressionBuilder;
import net.objecthunter.exp4j.ValidationResult;

/**
 * Arithmetic formula over columns, for example, <code>[price] * [quantity] + 1</code>. 
 * Column names in square brackets are replaced by native exp4j variables. 
 * The same column may be referenced several times but it is one parameter.
 */
public class FormulaFunction implements ComputedFunction {
	private static final Logger LOG = Logger.getLogger(FormulaFunction.class);

	private static final Pattern COLUMN_REFERENCE = Pattern.compile("\\[(.*?)\\]", Pattern.DOTALL);

	private final String formula;
	public String getFormula() {
		return formula;
	}

	// Column names in the order of their parameters
	private final List<String> params = new ArrayList<>();
	public List<String> getParams() {
		return new ArrayList<>(params);
	}

	private Expression expression;

	private DcError evaluateError;
	public DcError getEvaluateError() {
		return evaluateError;
	}

	//
	// Translate
	//

	protected String parse() {
		Matcher matcher = COLUMN_REFERENCE.matcher(this.formula);
		StringBuffer transformed = new StringBuffer();
		while(matcher.find()) {
			String name = matcher.group(1).trim();
			int paramNo = params.indexOf(name);
			if(paramNo < 0) {
				params.add(name);
				paramNo = params.size() - 1;
			}
			matcher.appendReplacement(transformed, paramName(paramNo));
		}
		matcher.appendTail(transformed);
		return transformed.toString();
	}

	protected void build(String transformedFormula) throws DcError {
		Set<String> vars = new HashSet<>();
		Map<String, Double> vals = new HashMap<>();
		for(int i = 0; i < params.size(); i++) {
			vars.add(paramName(i));
			vals.put(paramName(i), 0.0);
		}

		Expression exp;
		try {
			ExpressionBuilder builder = new ExpressionBuilder(transformedFormula);
			builder.variables(vars);
			exp = builder.build();
		}
		catch(Exception e) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Expression error.", e.getMessage(), e);
		}

		exp.setVariables(vals); // Validation requires variables to be set
		ValidationResult res = exp.validate();
		if(!res.isValid()) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Expression error.", res.getErrors() != null && res.getErrors().size() > 0 ? res.getErrors().get(0) : "");
		}
		this.expression = exp;
	}

	private static String paramName(int paramNo) {
		return "__p__" + paramNo;
	}

	//
	// Evaluate
	//

	/**
	 * Result of the formula or null if it cannot be computed for these arguments (for example, division by zero).
	 */
	@Override
	public Object compute(Object[] args) {
		this.evaluateError = null;
		try {
			for(int i = 0; i < params.size(); i++) {
				this.expression.setVariable(paramName(i), Values.toDouble(args[i]));
			}
			double ret = this.expression.evaluate();
			if(Double.isNaN(ret) || Double.isInfinite(ret)) return null;
			return ret;
		}
		catch(ArithmeticException | IllegalArgumentException e) {
			this.evaluateError = new DcError(DcErrorCode.EVALUATE_ERROR, "Evaluate error", "Error evaluating expression. " + e.getMessage());
			LOG.debugf("Formula '%s' cannot be evaluated: %s", formula, e.getMessage());
			return null;
		}
	}

	@Override
	public String toString() {
		return "[" + formula + "]";
	}

	public FormulaFunction(String formula) throws DcError {
		if(formula == null || formula.trim().isEmpty()) {
			throw new DcError(DcErrorCode.PARSE_ERROR, "Expression error.", "Formula is empty.");
		}
		this.formula = formula;
		String transformed = parse();
		build(transformed);
	}
}
