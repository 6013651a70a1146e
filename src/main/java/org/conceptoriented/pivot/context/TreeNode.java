package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a pivot tree. It stands for all rows whose pivot values start with the path of the node.
 */
public final class TreeNode {

	private final int id;
	public int getId() {
		return id;
	}

	private final TreeNode parent;
	public TreeNode getParent() {
		return parent;
	}

	// Pivot value of this level. Null for the root and for null pivot values.
	private final Object value;
	public Object getValue() {
		return value;
	}

	private final int depth;
	public int getDepth() {
		return depth;
	}

	private final Map<Object, TreeNode> children = new HashMap<>();
	public Collection<TreeNode> getChildren() {
		return children.values();
	}
	public boolean hasChildren() {
		return !children.isEmpty();
	}
	TreeNode getChild(Object value) {
		return children.get(value);
	}
	void addChild(TreeNode child) {
		children.put(child.value, child);
	}
	void removeChild(TreeNode child) {
		children.remove(child.value);
	}

	// Number of member rows in the subtree
	int count;
	public int getCount() {
		return count;
	}

	public boolean isRoot() {
		return parent == null;
	}

	public List<Object> getPath() {
		List<Object> path = new ArrayList<>();
		for(TreeNode n = this; n.parent != null; n = n.parent) {
			path.add(n.value);
		}
		Collections.reverse(path);
		return path;
	}

	/**
	 * This node and all its ancestors up to the root.
	 */
	public List<TreeNode> getLineage() {
		List<TreeNode> lineage = new ArrayList<>(depth + 1);
		for(TreeNode n = this; n != null; n = n.parent) {
			lineage.add(n);
		}
		return lineage;
	}

	@Override
	public String toString() {
		return "[" + id + ":" + getPath() + "]";
	}

	TreeNode(int id, TreeNode parent, Object value) {
		this.id = id;
		this.parent = parent;
		this.value = value;
		this.depth = parent == null ? 0 : parent.depth + 1;
	}
}
