package org.conceptoriented.pivot.core;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interned strings with reference counts. Ids of released strings are reused.
 */
public class Vocabulary {

	private final Map<String, Integer> ids = new HashMap<>();
	private final List<String> strings = new ArrayList<>();
	private final List<Integer> counts = new ArrayList<>();
	private final Deque<Integer> free = new ArrayDeque<>();

	/**
	 * Get the id of the string and increment its reference count.
	 */
	public int acquire(String value) {
		Integer id = ids.get(value);
		if(id != null) {
			counts.set(id, counts.get(id) + 1);
			return id;
		}

		if(!free.isEmpty()) {
			id = free.pop();
			strings.set(id, value);
			counts.set(id, 1);
		}
		else {
			id = strings.size();
			strings.add(value);
			counts.add(1);
		}
		ids.put(value, id);
		return id;
	}

	public void acquire(int id) {
		counts.set(id, counts.get(id) + 1);
	}

	public void release(int id) {
		int count = counts.get(id);
		if(count <= 0) {
			throw new DcFault("Vocabulary entry " + id + " released more times than acquired.");
		}
		if(count == 1) {
			ids.remove(strings.get(id));
			strings.set(id, null);
			counts.set(id, 0);
			free.push(id);
		}
		else {
			counts.set(id, count - 1);
		}
	}

	public String get(int id) {
		return strings.get(id);
	}

	public int getRefCount(String value) {
		Integer id = ids.get(value);
		return id == null ? 0 : counts.get(id);
	}

	public int size() {
		return ids.size();
	}

	public void clear() {
		ids.clear();
		strings.clear();
		counts.clear();
		free.clear();
	}
}
