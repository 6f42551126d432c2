package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.TemplateSpan;

/**
 * A parsed separator directive, consumed by the directive it belongs to. Instances which remain
 * in the document after parsing are orphans.
 */
public record SeparatorInstance(DirectiveDeclaration declaration, String source) implements Block, TemplateSpan {

    public String name() {
        return declaration.name();
    }
}
