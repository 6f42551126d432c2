package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.DocumentCursor;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Everything a directive part may look at when it is evaluated.
 *
 * @param declaration the parsed directive
 * @param source the original markup of the directive
 * @param bodyParser parses strings into elements of the family of the directive
 * @param cursor the document cursor, present only once the directive is resolved with one
 * @param parsedBody the body elements when already known, as for inline bodies and separators
 */
public record DirectiveContext<E>(DirectiveDeclaration declaration,
                                  String source,
                                  Function<String, List<E>> bodyParser,
                                  Optional<DocumentCursor> cursor,
                                  Optional<List<E>> parsedBody) {

    public static <E> DirectiveContext<E> of(DirectiveDeclaration declaration, String source, Function<String, List<E>> bodyParser) {
        return new DirectiveContext<>(declaration, source, bodyParser, Optional.empty(), Optional.empty());
    }

    public static <E> DirectiveContext<E> of(DirectiveDeclaration declaration,
                                             String source,
                                             Function<String, List<E>> bodyParser,
                                             Optional<List<E>> parsedBody) {
        return new DirectiveContext<>(declaration, source, bodyParser, Optional.empty(), parsedBody.map(List::copyOf));
    }

    public DirectiveContext<E> withCursor(DocumentCursor documentCursor) {
        return new DirectiveContext<>(declaration, source, bodyParser, Optional.of(documentCursor), parsedBody);
    }

    /**
     * Context for a separator found in the body of this directive.
     */
    DirectiveContext<E> forSeparator(SeparatorInstance separator, List<E> body) {
        return new DirectiveContext<>(separator.declaration(), separator.source(), bodyParser, cursor, Optional.of(List.copyOf(body)));
    }

    /**
     * The body parsed into elements, if the directive has a body.
     */
    public Optional<List<E>> body() {
        if (parsedBody.isPresent()) {
            return parsedBody;
        }
        return declaration.body()
                          .map(bodyParser);
    }
}
