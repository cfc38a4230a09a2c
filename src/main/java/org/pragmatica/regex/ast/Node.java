package org.pragmatica.regex.ast;

import java.util.List;
import java.util.Set;

/**
 * Regex AST node types - the building blocks of a compiled pattern.
 *
 * <p>The set of variants is closed. Code that needs to handle every variant
 * goes through {@link Visitor}, so adding a variant breaks every dispatch site
 * at compile time instead of falling through at run time.
 */
public sealed interface Node {

    /**
     * Stable type tag of this node.
     */
    NodeKind kind();

    /**
     * Structural children in matching order. Leaves return an empty list.
     */
    List<Node> children();

    <R> R accept(Visitor<R> visitor);

    // === Terminals ===

    /**
     * Single character: a
     */
    record Literal(char ch) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LITERAL;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * Any character: .
     */
    record Dot() implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.DOT;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDot(this);
        }
    }

    /**
     * Character class: [abc], [^abc]. Members are plain characters, there are no ranges.
     */
    record CharClass(Set<Character> chars, boolean negated) implements Node {
        public CharClass {
            chars = Set.copyOf(chars);
        }

        public boolean matches(char c) {
            return chars.contains(c) != negated;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CHAR_CLASS;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }
    }

    // === Anchors ===

    /**
     * Start of text: ^
     */
    record Start() implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.START;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStart(this);
        }
    }

    /**
     * End of text: $
     */
    record End() implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.END;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnd(this);
        }
    }

    // === Combinators ===

    /**
     * Concatenation: e1 e2 e3. An empty sequence matches the empty string.
     */
    record Sequence(List<Node> elements) implements Node {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEQUENCE;
        }

        @Override
        public List<Node> children() {
            return elements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Ordered choice: left | right
     */
    record Alternation(Node left, Node right) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.ALTERNATION;
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlternation(this);
        }
    }

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record Star(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.STAR;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStar(this);
        }
    }

    /**
     * One or more: e+
     */
    record Plus(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.PLUS;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlus(this);
        }
    }

    /**
     * Optional: e?
     */
    record Question(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.QUESTION;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuestion(this);
        }
    }

    /**
     * Lazy zero or more: e*?
     */
    record LazyStar(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LAZY_STAR;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLazyStar(this);
        }
    }

    /**
     * Lazy one or more: e+?
     */
    record LazyPlus(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LAZY_PLUS;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLazyPlus(this);
        }
    }

    /**
     * Lazy optional: e??
     */
    record LazyQuestion(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LAZY_QUESTION;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLazyQuestion(this);
        }
    }

    // === Groups and assertions ===

    /**
     * Non-capturing group: (?:e)
     */
    record NonCaptureGroup(Node node) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.NON_CAPTURE_GROUP;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonCaptureGroup(this);
        }
    }

    /**
     * Lookahead: (?=e) when positive, (?!e) otherwise
     */
    record Lookahead(Node node, boolean positive) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LOOKAHEAD;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLookahead(this);
        }
    }

    /**
     * Lookbehind: (?&lt;=e) when positive, (?&lt;!e) otherwise
     */
    record Lookbehind(Node node, boolean positive) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.LOOKBEHIND;
        }

        @Override
        public List<Node> children() {
            return List.of(node);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLookbehind(this);
        }
    }

    /**
     * Exhaustive dispatch over node variants.
     */
    interface Visitor<R> {
        R visitLiteral(Literal node);

        R visitDot(Dot node);

        R visitCharClass(CharClass node);

        R visitStart(Start node);

        R visitEnd(End node);

        R visitSequence(Sequence node);

        R visitAlternation(Alternation node);

        R visitStar(Star node);

        R visitPlus(Plus node);

        R visitQuestion(Question node);

        R visitLazyStar(LazyStar node);

        R visitLazyPlus(LazyPlus node);

        R visitLazyQuestion(LazyQuestion node);

        R visitNonCaptureGroup(NonCaptureGroup node);

        R visitLookahead(Lookahead node);

        R visitLookbehind(Lookbehind node);
    }
}
