package org.pragmatica.regex.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.regex.parser.PatternParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeDescriptorTest {

    @Test
    void describe_assignsPreOrderIds() {
        var descriptor = NodeDescriptor.describe(PatternParser.parse("a|bc"));

        assertEquals(0, descriptor.id());
        assertEquals(NodeKind.ALTERNATION, descriptor.kind());
        assertEquals(1, descriptor.children().get(0).id());
        assertEquals(2, descriptor.children().get(1).id());
        assertEquals(3, descriptor.children().get(1).children().get(0).id());
        assertEquals(4, descriptor.children().get(1).children().get(1).id());
        assertEquals(5, descriptor.size());
    }

    @Test
    void describe_literalAndCharClass_haveRepresentation() {
        var descriptor = NodeDescriptor.describe(PatternParser.parse("x[^cab]."));
        var children = descriptor.children();

        assertEquals(Optional.empty(), descriptor.repr());
        assertEquals(Optional.of("x"), children.get(0).repr());
        assertEquals(Optional.of("[^abc]"), children.get(1).repr());
        assertEquals(Optional.empty(), children.get(2).repr());
    }

    @Test
    void representation_onlyForLiteralsAndClasses() {
        assertEquals(Optional.of("["), NodeDescriptor.representation(new Node.Literal('[')));
        assertEquals(Optional.of("[^]"), NodeDescriptor.representation(new Node.CharClass(Set.of(), true)));
        assertEquals(Optional.empty(), NodeDescriptor.representation(new Node.Lookahead(new Node.Literal('a'), false)));
        assertEquals(Optional.empty(), NodeDescriptor.representation(new Node.LazyPlus(new Node.Dot())));
        assertEquals(Optional.empty(), NodeDescriptor.representation(new Node.End()));
    }

    @Test
    void render_indentsChildren() {
        var rendered = NodeDescriptor.describe(PatternParser.parse("(?=a)[bc]*")).render();

        assertEquals("""
            Sequence
              Lookahead
                Literal('a')
              Star
                CharClass([bc])
            """, rendered);
    }

    @Test
    void children_followMatchingOrder() {
        var alternation = new Node.Alternation(new Node.Literal('l'), new Node.Literal('r'));

        assertEquals(List.of(new Node.Literal('l'), new Node.Literal('r')), alternation.children());
        assertTrue(new Node.Dot().children().isEmpty());
        assertEquals(List.of(new Node.Dot()), new Node.Lookbehind(new Node.Dot(), false).children());
    }

    @Test
    void sequence_copiesElements() {
        var elements = new ArrayList<Node>(List.of(new Node.Literal('a')));
        var sequence = new Node.Sequence(elements);

        elements.add(new Node.Literal('b'));

        assertEquals(1, sequence.elements().size());
        assertThrows(UnsupportedOperationException.class, () -> sequence.elements().add(new Node.Dot()));
    }

    @Test
    void charClass_matchesByMembershipAndNegation() {
        var plain = new Node.CharClass(Set.of('a', 'b', 'c'), false);
        var negated = new Node.CharClass(Set.of('a', 'b', 'c'), true);

        assertTrue(plain.matches('b'));
        assertFalse(plain.matches('d'));
        assertFalse(negated.matches('b'));
        assertTrue(negated.matches('d'));
    }
}
