package org.conceptoriented.pivot.context;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.conceptoriented.pivot.core.DcFault;

/**
 * Tree of pivot value paths. Nodes are created when the first row contributes to them 
 * and removed when the last one leaves. Node ids are never reused.
 */
public class AggTree {

	private TreeNode root;
	public TreeNode getRoot() {
		return root;
	}

	private final Map<Integer, TreeNode> nodes = new HashMap<>();
	private int nextId;

	// Set when nodes are created or removed
	private boolean structureChanged;
	public boolean isStructureChanged() {
		return structureChanged;
	}
	public void clearStructureChanged() {
		structureChanged = false;
	}

	public TreeNode getNode(int id) {
		return nodes.get(id);
	}

	public int size() {
		return nodes.size();
	}

	/**
	 * Leaf of the path creating missing nodes.
	 */
	public TreeNode getOrCreate(List<Object> path) {
		TreeNode node = root;
		for(Object value : path) {
			TreeNode child = node.getChild(value);
			if(child == null) {
				child = new TreeNode(nextId++, node, value);
				node.addChild(child);
				nodes.put(child.getId(), child);
				structureChanged = true;
			}
			node = child;
		}
		return node;
	}

	/**
	 * Existing leaf of the path or null.
	 */
	public TreeNode find(List<Object> path) {
		TreeNode node = root;
		for(Object value : path) {
			node = node.getChild(value);
			if(node == null) return null;
		}
		return node;
	}

	/**
	 * Count a member row in the node and its ancestors.
	 */
	public void addMember(TreeNode leaf) {
		for(TreeNode n = leaf; n != null; n = n.getParent()) {
			n.count++;
		}
	}

	/**
	 * Uncount a member row and remove nodes left without members (except the root).
	 * 
	 * @param removed receives the ids of removed nodes
	 */
	public void removeMember(TreeNode leaf, List<Integer> removed) {
		for(TreeNode n = leaf; n != null; n = n.getParent()) {
			n.count--;
			if(n.count < 0) {
				throw new DcFault("Negative member count in pivot node " + n + ".");
			}
		}
		TreeNode n = leaf;
		while(n.getParent() != null && n.count == 0) {
			TreeNode parent = n.getParent();
			parent.removeChild(n);
			nodes.remove(n.getId());
			if(removed != null) removed.add(n.getId());
			structureChanged = true;
			n = parent;
		}
	}

	public void clear() {
		nodes.clear();
		root = new TreeNode(nextId++, null, null);
		nodes.put(root.getId(), root);
		structureChanged = true;
	}

	public AggTree() {
		clear();
		structureChanged = false;
	}
}
