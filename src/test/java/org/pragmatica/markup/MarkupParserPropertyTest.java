package org.pragmatica.markup;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Chars;
import net.jqwik.api.constraints.StringLength;
import org.pragmatica.markup.directive.DirectiveSupport;
import org.pragmatica.markup.directive.Parts;
import org.pragmatica.markup.directive.Spans;
import org.pragmatica.markup.directive.Templates;
import org.pragmatica.markup.markup.BasicMarkup;
import org.pragmatica.markup.tree.SpanSequence;
import org.pragmatica.markup.tree.TemplateSpanSequence;
import org.pragmatica.markup.tree.Text;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkupParserPropertyTest {
    private static final MarkupParser PARSER = MarkupParser.of(BasicMarkup.INSTANCE)
                                                           .using(DirectiveSupport.extensions(List.of(), List.of(
                                                               Spans.create("dir", Parts.all(Spans.dsl().attribute(0).optional(),
                                                                                             Spans.dsl().parsedBody(),
                                                                                             (attr, body) -> new SpanSequence(body))),
                                                               Spans.create("ref", Spans.dsl().attribute("key").map(Text::new)))))
                                                           .build();

    @Property(tries = 200)
    void parse_arbitraryMarkup_neverFails(@ForAll @StringLength(max = 200) @Chars({'a', ' ', '\n', '\r', '*', '\\', '@', ':', '$', '{', '}', '(', ')', '"', ','}) String input) {
        assertNotNull(PARSER.parse(input));
    }

    @Property(tries = 200)
    void parseTemplate_arbitraryInput_neverFails(@ForAll @StringLength(max = 200) @Chars({'a', ' ', '\n', '\\', '@', ':', '$', '{', '}', '(', ')'}) String input) {
        var parser = DirectiveSupport.templateParser(List.of(Templates.create("dir", Templates.dsl()
                                                                                             .parsedBody()
                                                                                             .map(TemplateSpanSequence::new))));

        assertTrue(parser.parse(input).isSuccess());
    }
}
