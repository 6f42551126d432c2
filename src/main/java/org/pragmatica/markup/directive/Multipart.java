package org.pragmatica.markup.directive;

import java.util.List;

/**
 * The body of a directive split at its separators.
 *
 * @param mainBody the elements in front of the first separator
 * @param children the results of the separators, in document order
 */
public record Multipart<E, T>(List<E> mainBody, List<T> children) {

    public Multipart {
        mainBody = List.copyOf(mainBody);
        children = List.copyOf(children);
    }
}
