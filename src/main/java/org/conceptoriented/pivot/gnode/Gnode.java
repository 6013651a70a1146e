package org.conceptoriented.pivot.gnode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.conceptoriented.pivot.context.Context;
import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcColumnKind;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.EngineConfig;
import org.conceptoriented.pivot.core.FaultPolicy;
import org.conceptoriented.pivot.core.LongColumn;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.jboss.logging.Logger;

/**
 * Processing node. It owns the state of one keyed table, its input and output ports, 
 * computed column definitions and the contexts registered on it. 
 * <p>
 * Mutating methods are serialized on the node. Contexts are notified only after the state of a batch is committed.
 */
public class Gnode implements AutoCloseable {
	private static final Logger LOG = Logger.getLogger(Gnode.class);

	private final String name;
	public String getName() {
		return name;
	}

	private final EngineConfig config;
	public EngineConfig getConfig() {
		return config;
	}

	private volatile GnodeStatus status = GnodeStatus.UNINITIALIZED;
	public GnodeStatus getStatus() {
		return status;
	}

	// Incremented on reset so that handles of dropped contexts can be detected
	private volatile long generation;
	public long getGeneration() {
		return generation;
	}

	//
	// Schemas
	//

	private final Schema outputSchema;
	private final DType pkeyType;

	/**
	 * User columns without computed and internal columns.
	 */
	public synchronized Schema getOutputSchema() {
		return outputSchema.copy();
	}

	/**
	 * Schema of fragments accepted by input ports.
	 */
	public synchronized Schema getInputSchema() {
		return outputSchema.copy().addColumn(Schema.PKEY, pkeyType).addColumn(Schema.OP, DType.UINT8);
	}

	/**
	 * User and computed columns.
	 */
	public synchronized Schema getDataSchema() {
		Schema schema = outputSchema.copy();
		computed.forEach(c -> schema.addColumn(c.getName(), c.getDType()));
		return schema;
	}

	public DType getPkeyType() {
		return pkeyType;
	}

	public synchronized DcColumnKind getColumnKind(String column) {
		if(Schema.isInternal(column)) return DcColumnKind.INTERNAL;
		if(outputSchema.hasColumn(column)) return DcColumnKind.USER;
		if(computed.stream().anyMatch(c -> c.getName().equals(column))) return DcColumnKind.CALC;
		return DcColumnKind.NONE;
	}

	//
	// State, ports, computed columns, contexts
	//

	private GnodeState state;
	public GnodeState getState() {
		return state;
	}

	private final List<Port> inputs = new ArrayList<>();
	private final Map<PortRole, Port> outputs = new EnumMap<>(PortRole.class);

	private final List<ComputedColumn> computed = new ArrayList<>();
	public synchronized List<ComputedColumn> getComputedColumns() {
		return new ArrayList<>(computed);
	}

	private final Map<String, Context> contexts = new LinkedHashMap<>();

	private ExecutorService pool;

	//
	// Lifecycle
	//

	public synchronized void init() {
		if(status != GnodeStatus.UNINITIALIZED) return;
		this.state = new GnodeState(getStateSchema());
		this.inputs.add(new Port(0, PortRole.INPUT, getInputSchema()));
		for(PortRole role : PortRole.values()) {
			if(role.isOutput()) outputs.put(role, new Port(0, role, new Schema()));
		}
		this.status = GnodeStatus.IDLE;
		LOG.infof("Gnode '%s' initialized with schema %s", name, outputSchema);
	}

	private Schema getStateSchema() {
		return getDataSchema().addColumn(Schema.PKEY, pkeyType).addColumn(Schema.OKEY, pkeyType);
	}

	/**
	 * Drop all rows, queued fragments and registered contexts. Port ids and computed columns remain.
	 */
	public synchronized void reset() {
		if(status == GnodeStatus.UNINITIALIZED) return;
		state.reset();
		inputs.forEach(Port::clear);
		outputs.values().forEach(Port::clear);
		contexts.values().forEach(Context::reset);
		contexts.clear();
		generation++;
		status = GnodeStatus.IDLE;
		LOG.infof("Gnode '%s' reset (generation %d)", name, generation);
	}

	@Override
	public synchronized void close() {
		if(pool != null) {
			pool.shutdownNow();
			pool = null;
		}
		contexts.clear();
		generation++;
		if(state != null) state.reset();
		status = GnodeStatus.UNINITIALIZED;
	}

	private void checkReady() throws DcError {
		if(status == GnodeStatus.UNINITIALIZED) {
			throw new DcError(DcErrorCode.INVALID_STATE, "Gnode is not initialized.", name);
		}
		if(status == GnodeStatus.FAILED) {
			throw new DcError(DcErrorCode.INVALID_STATE, "Gnode failed and has to be reset.", name);
		}
	}

	//
	// Ports
	//

	public synchronized int makeInputPort() throws DcError {
		checkReady();
		Port port = new Port(inputs.size(), PortRole.INPUT, getInputSchema());
		inputs.add(port);
		return port.getId();
	}

	public synchronized int getInputPortCount() {
		return inputs.size();
	}

	private Port getInputPort(int portId) throws DcError {
		if(portId < 0 || portId >= inputs.size()) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Unknown port.", "Port " + portId + " does not exist.");
		}
		return inputs.get(portId);
	}

	/**
	 * Queue a fragment. The fragment has to have exactly the input schema. 
	 * It is read when the port is processed and is not modified by processing.
	 */
	public synchronized void send(int portId, Table fragment) throws DcError {
		checkReady();
		getInputPort(portId).push(fragment);
	}

	/**
	 * Table of the last processed batch for an output role or null if nothing was processed.
	 */
	public synchronized Table getOutputTable(PortRole role) {
		Port port = outputs.get(role);
		return port == null ? null : port.getTable();
	}

	//
	// Processing
	//

	public synchronized ProcessResult sendAndProcess(Table fragment) throws DcError {
		send(0, fragment);
		return process(0);
	}

	/**
	 * Process all input ports in the order of their creation.
	 */
	public synchronized List<ProcessResult> processAll() throws DcError {
		List<ProcessResult> results = new ArrayList<>();
		for(int i = 0; i < inputs.size(); i++) {
			if(!inputs.get(i).isEmpty()) results.add(process(i));
		}
		return results;
	}

	/**
	 * Apply the queued fragments of the port to the state and notify contexts.
	 * Internal faults are handled according to the fault policy of the engine configuration.
	 */
	public synchronized ProcessResult process(int portId) throws DcError {
		checkReady();
		Port port = getInputPort(portId);
		if(port.isEmpty()) {
			port.clear();
			return new ProcessResult(portId, null, false);
		}

		status = GnodeStatus.PROCESSING;
		try {
			boolean concatenated = port.getFragmentCount() > 1;
			ProcessResult result = processBatch(portId, port.drain(), concatenated);
			status = GnodeStatus.IDLE;
			return result;
		}
		catch(DcFault fault) {
			throw fail(fault);
		}
		catch(RuntimeException e) {
			throw fail(new DcFault(e.toString(), e));
		}
	}

	private DcError fail(DcFault fault) {
		status = GnodeStatus.FAILED;
		LOG.errorf(fault, "Gnode '%s' failed to process a batch: %s", name, fault.getMessage());
		if(config.getFaultPolicy() == FaultPolicy.ABORT) {
			throw fault;
		}
		return new DcError(DcErrorCode.FAULT, "Internal fault.", fault.getMessage(), fault);
	}

	/**
	 * @param owned whether the batch was created by the port and can be released after flattening
	 */
	private ProcessResult processBatch(int portId, Table batch, boolean owned) {
		long start = System.nanoTime();
		int batchSize = batch.getSize();

		// Flatten
		ProcessState ps = Flattener.flatten(batch);
		if(owned) batch.release();
		Table flattened = ps.flattened;
		int n = ps.size();

		// Lookup and allocate state slots
		for(int i = 0; i < n; i++) {
			ps.lookups[i] = state.lookup(ps.pkeys[i]);
			ps.slots[i] = ps.ops[i] == Op.DELETE ? ps.lookups[i].getIndex() : state.allocate(ps.pkeys[i]);
		}

		// Output tables
		Schema dataSchema = getDataSchema();
		for(ComputedColumn c : computed) {
			flattened.addColumn(c.getName(), c.getDType());
		}
		ps.delta = newTable("delta", dataSchema, n);
		ps.prev = newTable("prev", dataSchema, n);
		ps.current = newTable("current", dataSchema, n);
		Schema transitionSchema = new Schema();
		dataSchema.getColumns().forEach(c -> transitionSchema.addColumn(c, DType.UINT8));
		ps.transitions = newTable("transitions", transitionSchema, n);
		ps.existed = newTable("existed", new Schema().addColumn(Schema.EXISTED, DType.BOOL), n);

		// Diff user columns
		diffColumns(ps, outputSchema.getColumns());

		// Computed columns are evaluated on the diffed values and then diffed themselves
		for(ComputedColumn c : computed) {
			new ColumnEvaluator(c).evaluate(ps, ps.current, ps.transitions, flattened.getColumn(c.getName()));
			newDiff(ps, c.getName()).diff(ps);
		}

		// Commit
		LongColumn existed = (LongColumn)ps.existed.getColumn(Schema.EXISTED);
		boolean shouldNotify = false;
		int inserted = 0, deleted = 0;
		for(int i = 0; i < n; i++) {
			boolean preExisted = ps.lookups[i].exists();
			if(ps.ops[i] == Op.DELETE) {
				existed.setLong(i, preExisted ? 1 : 0);
				if(preExisted) {
					state.tombstone(ps.pkeys[i]);
					shouldNotify = true;
					deleted++;
				}
			}
			else {
				existed.setLong(i, 1);
				state.upsert(ps.pkeys[i], ps.slots[i], ps.current, i);
				if(!preExisted) {
					shouldNotify = true;
					inserted++;
				}
			}
		}
		if(!shouldNotify) {
			shouldNotify = hasChanges(ps.transitions);
		}

		// Outputs
		outputs.get(PortRole.FLATTENED).setTable(flattened);
		outputs.get(PortRole.DELTA).setTable(ps.delta);
		outputs.get(PortRole.PREV).setTable(ps.prev);
		outputs.get(PortRole.CURRENT).setTable(ps.current);
		outputs.get(PortRole.TRANSITIONS).setTable(ps.transitions);
		outputs.get(PortRole.EXISTED).setTable(ps.existed);

		// Notify
		if(shouldNotify) {
			NotifyFrame frame = new NotifyFrame(ps);
			for(Context ctx : contexts.values()) {
				ctx.notify(frame);
			}
		}

		LOG.debugf("Gnode '%s' port %d: %d rows flattened to %d keys (%d inserted, %d deleted, notify=%b) in %d us",
				name, portId, batchSize, n, inserted, deleted, shouldNotify, (System.nanoTime() - start) / 1000);
		return new ProcessResult(portId, flattened, shouldNotify);
	}

	private static Table newTable(String name, Schema schema, int size) {
		Table table = new Table(name, schema);
		table.setSize(size);
		return table;
	}

	private static boolean hasChanges(Table transitions) {
		for(Column c : transitions.getColumns()) {
			LongColumn t = (LongColumn)c;
			for(int i = 0; i < t.size(); i++) {
				if(ValueTransition.fromValue(t.getLong(i)).isChange()) return true;
			}
		}
		return false;
	}

	private ColumnDiff newDiff(ProcessState ps, String column) {
		Column stored = state.getTable().getColumn(column);
		Column incoming = ps.flattened.getColumn(column);
		if(stored == null || incoming == null) {
			throw new DcFault("Column '" + column + "' is missing in the batch or in the state.");
		}
		return new ColumnDiff(column, incoming, stored, 
				ps.delta.getColumn(column), ps.prev.getColumn(column), ps.current.getColumn(column), 
				(LongColumn)ps.transitions.getColumn(column));
	}

	// Columns are independent so they can be diffed concurrently. All of them are finished on return.
	private void diffColumns(ProcessState ps, List<String> columns) {
		List<ColumnDiff> diffs = columns.stream().map(c -> newDiff(ps, c)).collect(Collectors.toList());
		int parallelism = config.getDiffParallelism();
		if(parallelism <= 1 || diffs.size() < 2) {
			diffs.forEach(d -> d.diff(ps));
			return;
		}

		if(pool == null) {
			pool = Executors.newFixedThreadPool(parallelism, r -> {
				Thread t = new Thread(r, "gnode-" + name + "-diff");
				t.setDaemon(true);
				return t;
			});
		}
		List<Callable<Void>> tasks = diffs.stream().map(d -> (Callable<Void>)() -> {
			d.diff(ps);
			return null;
		}).collect(Collectors.toList());

		try {
			for(Future<Void> f : pool.invokeAll(tasks)) {
				f.get();
			}
		}
		catch(InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DcFault("Column diff interrupted.", e);
		}
		catch(ExecutionException e) {
			if(e.getCause() instanceof DcFault) throw (DcFault)e.getCause();
			throw new DcFault("Column diff failed: " + e.getCause(), e.getCause());
		}
	}

	//
	// Schema changes
	//

	/**
	 * Widen the type of a user column in the state, in queued fragments and in computed columns depending on it. 
	 * Registered contexts are rebuilt from the state.
	 */
	public synchronized void promoteColumn(String column, DType dtype) throws DcError {
		checkReady();
		if(!outputSchema.hasColumn(column)) {
			throw new DcError(DcErrorCode.UNKNOWN_COLUMN, "Unknown column.", "Column '" + column + "' not found.");
		}
		DType old = outputSchema.getType(column);
		if(old == dtype) return;
		if(!old.canPromoteTo(dtype)) {
			throw new DcFault("Column '" + column + "' of type " + old + " cannot be promoted to " + dtype + ".");
		}

		// Check dependent computed columns before anything is changed
		Schema oldSchema = getDataSchema();
		Schema newSchema = oldSchema.copy();
		newSchema.retype(column, dtype);
		List<ComputedColumn> dependents = computed.stream().filter(c -> c.getInputs().contains(column)).collect(Collectors.toList());
		try {
			for(ComputedColumn c : dependents) {
				c.bind(newSchema);
				newSchema.retype(c.getName(), c.getDType());
			}
		}
		catch(DcError e) {
			for(ComputedColumn c : dependents) c.bind(oldSchema);
			throw e;
		}

		outputSchema.retype(column, dtype);
		state.promoteColumn(column, dtype);
		inputs.forEach(p -> p.promoteColumn(column, dtype));
		for(ComputedColumn c : dependents) {
			if(oldSchema.getType(c.getName()) != c.getDType()) {
				state.promoteColumn(c.getName(), c.getDType());
			}
		}
		LOG.infof("Gnode '%s' promoted column '%s' from %s to %s", name, column, old, dtype);

		renotifyContexts();
	}

	/**
	 * Add computed columns and evaluate them for all live rows.
	 */
	public synchronized void addComputedColumns(List<ComputedColumn> columns) throws DcError {
		checkReady();
		Schema schema = getDataSchema();
		for(ComputedColumn c : columns) {
			if(schema.hasColumn(c.getName()) || Schema.isInternal(c.getName())) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Column already exists.", "Computed column '" + c.getName() + "' conflicts with an existing column.");
			}
			c.bind(schema);
			schema.addColumn(c.getName(), c.getDType());
		}

		List<Integer> slots = state.getSlots();
		for(ComputedColumn c : columns) {
			computed.add(c);
			state.addColumn(c.getName(), c.getDType());
			new ColumnEvaluator(c).evaluateAll(state.getTable(), slots);
		}
		LOG.infof("Gnode '%s' added computed columns %s", name, columns);
	}

	private void renotifyContexts() {
		if(contexts.isEmpty()) return;
		Table snapshot = state.snapshot();
		for(Context ctx : contexts.values()) {
			ctx.reset();
			ctx.notify(snapshot);
		}
		snapshot.release();
	}

	//
	// Contexts
	//

	/**
	 * Register a context and load the current state into it.
	 */
	public synchronized void registerContext(String contextName, Context ctx) throws DcError {
		checkReady();
		if(contexts.containsKey(contextName)) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Context already registered.", "Context '" + contextName + "' already exists.");
		}
		ctx.init(state);
		if(state.size() > 0) {
			Table snapshot = state.snapshot();
			ctx.notify(snapshot);
			snapshot.release();
		}
		contexts.put(contextName, ctx);
		LOG.infof("Gnode '%s' registered context '%s' with %d sides", name, contextName, ctx.sides());
	}

	public synchronized void unregisterContext(String contextName) {
		Context ctx = contexts.remove(contextName);
		if(ctx != null) {
			ctx.reset();
			LOG.infof("Gnode '%s' unregistered context '%s'", name, contextName);
		}
	}

	public synchronized Context getContext(String contextName) {
		return contexts.get(contextName);
	}

	public synchronized List<String> getRegisteredContexts() {
		return new ArrayList<>(contexts.keySet());
	}

	/**
	 * Whether a handle taken in the specified generation still refers to a registered context.
	 */
	public synchronized boolean isRegistered(String contextName, long handleGeneration) {
		return handleGeneration == generation && contexts.containsKey(contextName);
	}

	//
	// State access
	//

	public synchronized List<Object> getPkeys() {
		return state.getPkeys();
	}

	public synchronized boolean hasPkey(Object pkey) {
		return state.hasPkey(pkey);
	}

	public synchronized boolean hasPkeys(Collection<?> pkeys) {
		return state.hasPkeys(pkeys);
	}

	public synchronized int size() {
		return state == null ? 0 : state.size();
	}

	/**
	 * Live rows in key order.
	 */
	public synchronized Table getTable() {
		return state.snapshot();
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	public Gnode(String name, Schema outputSchema, DType pkeyType, EngineConfig config) {
		for(String c : outputSchema.getColumns()) {
			if(Schema.isInternal(c)) {
				throw new DcFault("Column name '" + c + "' is reserved.");
			}
		}
		this.name = name;
		this.outputSchema = outputSchema.copy();
		this.pkeyType = pkeyType;
		this.config = config;
	}
}
