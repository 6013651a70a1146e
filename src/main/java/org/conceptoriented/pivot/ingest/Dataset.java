package org.conceptoriented.pivot.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Record;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.conceptoriented.pivot.gnode.ComputedColumn;
import org.conceptoriented.pivot.gnode.Gnode;
import org.conceptoriented.pivot.gnode.Op;
import org.conceptoriented.pivot.gnode.ProcessResult;
import org.conceptoriented.pivot.view.View;
import org.conceptoriented.pivot.view.ViewConfig;
import org.jboss.logging.Logger;

/**
 * Keyed table fed with records. Every update is processed immediately and then reported to the listeners of its views.
 */
public class Dataset implements AutoCloseable {
	private static final Logger LOG = Logger.getLogger(Dataset.class);

	private static final AtomicInteger NEXT_ID = new AtomicInteger();

	private final Gnode gnode;
	public Gnode getGnode() {
		return gnode;
	}

	private final DatasetOptions options;
	public DatasetOptions getOptions() {
		return options;
	}

	private final FragmentBuilder builder;

	// Next running key of datasets without an index
	private long offset;

	private final List<View> views = new ArrayList<>();
	private int nextView;

	//
	// Creation
	//

	public static Dataset fromSchema(Schema schema, DatasetOptions options) throws DcError {
		DType pkeyType = DType.INT64;
		if(options.getIndex() != null) {
			if(options.getLimit() > 0) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid dataset options.", "Index and limit cannot be used together.");
			}
			if(!schema.hasColumn(options.getIndex())) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid dataset options.", "Index column '" + options.getIndex() + "' not found in " + schema + ".");
			}
			pkeyType = schema.getType(options.getIndex());
		}
		if(options.getLimit() < 0) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid dataset options.", "Limit cannot be negative.");
		}
		for(String c : schema.getColumns()) {
			if(Schema.isInternal(c)) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid schema.", "Column name '" + c + "' is reserved.");
			}
		}

		String name = options.getName() != null ? options.getName() : "dataset_" + NEXT_ID.getAndIncrement();
		Gnode gnode = new Gnode(name, schema, pkeyType, options.getConfig());
		gnode.init();
		return new Dataset(gnode, options);
	}

	/**
	 * Dataset with the schema inferred from the records and loaded with them.
	 */
	public static Dataset fromRecords(List<Record> records, DatasetOptions options) throws DcError {
		Dataset dataset = fromSchema(TypeInference.infer(records), options);
		dataset.update(records);
		return dataset;
	}

	public static Dataset fromJson(String json, DatasetOptions options) throws DcError {
		return fromRecords(Record.fromJsonList(json), options);
	}

	public static Dataset fromCsv(String csv, DatasetOptions options) throws DcError {
		return fromRecords(Record.fromCsvList(csv), options);
	}

	//
	// Updates
	//

	public void update(List<Record> records) throws DcError {
		update(records, 0);
	}

	/**
	 * Insert or update rows through the port. Fields missing in a record leave the stored values unchanged.
	 */
	public synchronized void update(List<Record> records, int portId) throws DcError {
		if(records.isEmpty()) return;
		builder.validate(records);
		long start = offset;
		List<Object> pkeys = makeKeys(records);
		try {
			send(portId, builder.build(records, pkeys, Op.INSERT));
		}
		catch(DcError | RuntimeException e) {
			offset = start;
			throw e;
		}
	}

	public void updateJson(String json) throws DcError {
		update(Record.fromJsonList(json), 0);
	}

	public void updateCsv(String csv) throws DcError {
		update(Record.fromCsvList(csv), 0);
	}

	public void remove(Object... keys) throws DcError {
		remove(Arrays.asList(keys));
	}

	public synchronized void remove(List<Object> keys) throws DcError {
		if(keys.isEmpty()) return;
		checkKeys(keys);
		send(0, builder.buildKeys(keys, Op.DELETE));
	}

	/**
	 * Delete all rows.
	 */
	public synchronized void clear() throws DcError {
		List<Object> keys = gnode.getPkeys();
		if(keys.isEmpty()) return;
		send(0, builder.buildKeys(keys, Op.DELETE));
	}

	/**
	 * Delete all rows and insert the records in one batch. Running keys start from zero again.
	 */
	public synchronized void replace(List<Record> records) throws DcError {
		builder.validate(records);
		long start = offset;
		offset = 0;
		try {
			List<Object> pkeys = makeKeys(records);
			Table inserts = builder.build(records, pkeys, Op.INSERT);
			Table deletes = builder.buildKeys(gnode.getPkeys(), Op.DELETE);
			Schema schema = gnode.getInputSchema();
			send(0, Table.concat("fragment", schema, Arrays.asList(deletes, inserts)));
			deletes.release();
			inserts.release();
		}
		catch(DcError | RuntimeException e) {
			offset = start;
			throw e;
		}
	}

	private List<Object> makeKeys(List<Record> records) throws DcError {
		List<Object> pkeys = new ArrayList<>(records.size());
		String index = options.getIndex();
		for(Record r : records) {
			if(index != null) {
				Object key = r.get(index);
				if(key == null) {
					throw new DcError(DcErrorCode.SCHEMA_MISMATCH, "Missing index value.", "Record " + r + " has no value for index column '" + index + "'.");
				}
				if(!FragmentBuilder.fits(key, gnode.getPkeyType())) {
					throw new DcError(DcErrorCode.SCHEMA_MISMATCH, "Invalid index value.", "Value '" + key + "' does not fit the index type " + gnode.getPkeyType() + ".");
				}
				pkeys.add(key);
			}
			else {
				long key = options.getLimit() > 0 ? offset % options.getLimit() : offset;
				offset++;
				pkeys.add(key);
			}
		}
		return pkeys;
	}

	private void checkKeys(List<Object> keys) throws DcError {
		for(Object key : keys) {
			if(key == null || !FragmentBuilder.fits(key, gnode.getPkeyType())) {
				throw new DcError(DcErrorCode.SCHEMA_MISMATCH, "Invalid key.", "Value '" + key + "' does not fit the key type " + gnode.getPkeyType() + ".");
			}
		}
	}

	private void send(int portId, Table fragment) throws DcError {
		int rows = fragment.getSize();
		gnode.send(portId, fragment);
		ProcessResult result = gnode.process(portId);
		LOG.debugf("Dataset '%s' processed %d rows from port %d", gnode.getName(), rows, portId);
		if(result.shouldNotify()) {
			fireUpdate(portId);
		}
	}

	private void fireUpdate(int portId) {
		views.removeIf(View::isStale);
		for(View v : new ArrayList<>(views)) {
			v.fireUpdate(portId);
		}
	}

	//
	// Ports, views and computed columns
	//

	public int makePort() throws DcError {
		return gnode.makeInputPort();
	}

	public synchronized View view(ViewConfig config) throws DcError {
		View view = View.create(gnode, "view_" + nextView++, config);
		views.add(view);
		return view;
	}

	public void addComputedColumns(List<ComputedColumn> columns) throws DcError {
		gnode.addComputedColumns(columns);
	}

	//
	// Read
	//

	public int size() {
		return gnode.size();
	}

	/**
	 * Column name to canonical type name including computed columns.
	 */
	public Map<String, String> schema() {
		return gnode.getDataSchema().toTypeNames();
	}

	public List<String> columns() {
		return gnode.getDataSchema().getColumns();
	}

	public List<Object> getPkeys() {
		return gnode.getPkeys();
	}

	public Record getRecord(Object pkey) {
		return gnode.getState().getRecord(FragmentBuilder.convert(pkey, gnode.getPkeyType()));
	}

	/**
	 * Delete all views and release the data.
	 */
	public synchronized void delete() {
		new ArrayList<>(views).forEach(View::delete);
		views.clear();
		gnode.close();
		LOG.infof("Dataset '%s' deleted", gnode.getName());
	}

	@Override
	public void close() {
		delete();
	}

	@Override
	public String toString() {
		return "[" + gnode.getName() + "]";
	}

	private Dataset(Gnode gnode, DatasetOptions options) {
		this.gnode = gnode;
		this.options = options;
		this.builder = new FragmentBuilder(gnode);
	}
}
