package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.DeferredBlock;
import org.pragmatica.markup.tree.DocumentCursor;
import org.pragmatica.markup.tree.InvalidBlock;

import java.util.function.Function;

/**
 * Block directives. A block directive starts at the beginning of a line, its body consists of whole
 * lines up to a line holding only the fence.
 */
public final class Blocks {
    private Blocks() {}

    public static final DirectiveFamily<Block> FAMILY = new DirectiveFamily<>() {
        @Override
        public String description() {
            return "block";
        }

        @Override
        public Block invalid(String message, String source) {
            return new InvalidBlock(message, source);
        }

        @Override
        public Block deferred(Function<DocumentCursor, Block> resolver, String source) {
            return new DeferredBlock(resolver, source);
        }

        @Override
        public Block separatorInstance(DirectiveDeclaration declaration, String source) {
            return new SeparatorInstance(declaration, source);
        }
    };

    private static final DirectiveDsl<Block> DSL = new DirectiveDsl<>();

    public static DirectiveDsl<Block> dsl() {
        return DSL;
    }

    public static Directive<Block> create(String name, DirectivePart<Block, ? extends Block> part) {
        return new Directive<>(name, part);
    }

    /**
     * A separator without occurrence constraints, use {@link SeparatorDirective#withMin} and
     * {@link SeparatorDirective#withMax} to add them.
     */
    public static <T> SeparatorDirective<Block, T> separator(String name, DirectivePart<Block, T> part) {
        return new SeparatorDirective<>(name, part, 0, Integer.MAX_VALUE);
    }
}
