package org.pragmatica.markup.tree;

import java.util.List;

/**
 * A node holding a list of template spans.
 */
public interface TemplateSpanContainer<Self extends TemplateSpanContainer<Self>> extends Element {

    List<TemplateSpan> content();

    Self withContent(List<TemplateSpan> content);
}
