package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.DocumentCursor;

import java.util.function.Function;

/**
 * The node kinds a directive family produces besides the results of its directives.
 */
public interface DirectiveFamily<E> {

    /**
     * Short name used in messages: {@code span}, {@code block} or {@code template}.
     */
    String description();

    E invalid(String message, String source);

    E deferred(Function<DocumentCursor, E> resolver, String source);

    E separatorInstance(DirectiveDeclaration declaration, String source);
}
