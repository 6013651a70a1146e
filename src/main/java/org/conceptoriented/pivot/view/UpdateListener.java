package org.conceptoriented.pivot.view;

/**
 * Called after a batch sent through the owning dataset has been processed.
 */
@FunctionalInterface
public interface UpdateListener {
	void onUpdate(View view, int portId);
}
