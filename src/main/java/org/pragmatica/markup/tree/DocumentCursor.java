package org.pragmatica.markup.tree;

import java.util.Map;
import java.util.Optional;

/**
 * Access to the context of the document being processed, provided by the caller of the rewrite step.
 *
 * <p>Parsers never look into the cursor, they only hand it to the directives which request it.
 */
public interface DocumentCursor {

    /**
     * The path of the document within its document tree.
     */
    String path();

    /**
     * The configuration value for the specified key, if present.
     */
    Optional<String> config(String key);

    static DocumentCursor of(String path, Map<String, String> config) {
        var values = Map.copyOf(config);
        return new DocumentCursor() {
            @Override
            public String path() {
                return path;
            }

            @Override
            public Optional<String> config(String key) {
                return Optional.ofNullable(values.get(key));
            }

            @Override
            public String toString() {
                return "DocumentCursor(" + path + ")";
            }
        };
    }
}
