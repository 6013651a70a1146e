package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Visible part of a pivot tree. A node is expanded if it was explicitly opened, 
 * or if it is above the automatic expansion depth and was not explicitly closed.
 */
public class Traversal {

	// Negative means unlimited
	private int depth;
	public int getDepth() {
		return depth;
	}

	private final Set<Integer> opened = new HashSet<>();
	private final Set<Integer> closed = new HashSet<>();

	private final List<TreeNode> visible = new ArrayList<>();
	private final Map<Integer, Integer> positions = new HashMap<>();

	public boolean isExpanded(TreeNode node) {
		if(!node.hasChildren()) return false;
		if(closed.contains(node.getId())) return false;
		if(opened.contains(node.getId())) return true;
		return depth < 0 || node.getDepth() < depth;
	}

	/**
	 * Lay out the visible nodes in pre-order. 
	 */
	public void rebuild(TreeNode root, Function<TreeNode, List<TreeNode>> orderedChildren) {
		visible.clear();
		positions.clear();
		visit(root, orderedChildren);
	}

	private void visit(TreeNode node, Function<TreeNode, List<TreeNode>> orderedChildren) {
		positions.put(node.getId(), visible.size());
		visible.add(node);
		if(!isExpanded(node)) return;
		for(TreeNode child : orderedChildren.apply(node)) {
			visit(child, orderedChildren);
		}
	}

	public int size() {
		return visible.size();
	}

	public TreeNode get(int idx) {
		if(idx < 0 || idx >= visible.size()) return null;
		return visible.get(idx);
	}

	/**
	 * Position of the node or -1 if it is not visible.
	 */
	public int indexOf(int nodeId) {
		Integer pos = positions.get(nodeId);
		return pos == null ? -1 : pos;
	}

	public void open(TreeNode node) {
		closed.remove(node.getId());
		opened.add(node.getId());
	}

	public void close(TreeNode node) {
		opened.remove(node.getId());
		closed.add(node.getId());
	}

	public void setDepth(int depth) {
		this.depth = depth;
		opened.clear();
		closed.clear();
	}

	/**
	 * Drop the expansion state of removed nodes.
	 */
	public void forget(Collection<Integer> nodeIds) {
		opened.removeAll(nodeIds);
		closed.removeAll(nodeIds);
	}

	public Traversal(int depth) {
		this.depth = depth;
	}
}
