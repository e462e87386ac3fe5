package org.javai.cdlexport.model;

/**
 * Pre-pass resolving inheritance, extension and redeclaration into one concrete
 * instance tree. Export runs call it once before classification.
 */
@FunctionalInterface
public interface ModelFlattener {

	/** Flattener for trees the front-end already delivers flattened. */
	ModelFlattener IDENTITY = root -> root;

	Instance flatten(Instance root);
}
