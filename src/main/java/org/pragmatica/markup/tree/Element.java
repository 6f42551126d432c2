package org.pragmatica.markup.tree;

/**
 * Base type of all document tree nodes. All nodes are immutable.
 */
public interface Element {}
