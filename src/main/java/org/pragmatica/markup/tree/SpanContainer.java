package org.pragmatica.markup.tree;

import java.util.List;

/**
 * A node holding a list of spans.
 */
public interface SpanContainer<Self extends SpanContainer<Self>> extends Element {

    List<Span> content();

    Self withContent(List<Span> content);
}
