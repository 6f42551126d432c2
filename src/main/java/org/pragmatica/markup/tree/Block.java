package org.pragmatica.markup.tree;

/**
 * Structural node like a paragraph or a list.
 */
public interface Block extends Element {}
