package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;

/**
 * Conjunction or disjunction of filter terms. An empty filter accepts every row.
 */
public final class Filter {

	public enum Combinator {
		AND,
		OR,
	}

	public static final Filter ALL = new Filter(Collections.emptyList(), Combinator.AND);

	private final List<FilterTerm> terms;
	public List<FilterTerm> getTerms() {
		return terms;
	}

	private final Combinator combinator;
	public Combinator getCombinator() {
		return combinator;
	}

	public boolean isEmpty() {
		return terms.isEmpty();
	}

	public boolean matches(Table table, int row) {
		if(terms.isEmpty()) return true;
		for(FilterTerm term : terms) {
			Column c = table.getColumn(term.getColumn());
			boolean ok = term.test(c.getValue(row));
			if(combinator == Combinator.AND && !ok) return false;
			if(combinator == Combinator.OR && ok) return true;
		}
		return combinator == Combinator.AND;
	}

	/**
	 * Filter with operands converted to the column types of the schema.
	 */
	public Filter bind(Schema schema) throws DcError {
		List<FilterTerm> bound = new ArrayList<>();
		for(FilterTerm term : terms) {
			if(!schema.hasColumn(term.getColumn())) {
				throw new DcError(DcErrorCode.UNKNOWN_COLUMN, "Unknown column.", "Filter column '" + term.getColumn() + "' not found.");
			}
			bound.add(term.bind(schema.getType(term.getColumn())));
		}
		return new Filter(bound, combinator);
	}

	@Override
	public String toString() {
		return terms.toString();
	}

	public Filter(List<FilterTerm> terms, Combinator combinator) {
		this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
		this.combinator = combinator;
	}
}
