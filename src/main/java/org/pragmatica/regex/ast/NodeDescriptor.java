package org.pragmatica.regex.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only, tree-shaped description of an AST, suitable for serializers and renderers.
 *
 * <p>Ids are assigned in pre-order starting at 0, so they are stable for a given tree.
 */
public record NodeDescriptor(int id, NodeKind kind, Optional<String> repr, List<NodeDescriptor> children) {

    public NodeDescriptor {
        children = List.copyOf(children);
    }

    public static NodeDescriptor describe(Node root) {
        return describe(root, new int[]{0});
    }

    private static NodeDescriptor describe(Node node, int[] nextId) {
        var id = nextId[0]++;
        var children = new ArrayList<NodeDescriptor>();
        for (var child : node.children()) {
            children.add(describe(child, nextId));
        }
        return new NodeDescriptor(id, node.kind(), representation(node), children);
    }

    /**
     * Literal character or character-class notation; empty for every other node.
     */
    public static Optional<String> representation(Node node) {
        return node.accept(Representation.INSTANCE);
    }

    /**
     * Total number of nodes in this subtree.
     */
    public int size() {
        var size = 1;
        for (var child : children) {
            size += child.size();
        }
        return size;
    }

    /**
     * Label of this node alone, e.g. {@code Literal('a')} or {@code CharClass([^xy])}.
     */
    public String label() {
        return repr.map(r -> kind.label() + "(" + (kind == NodeKind.LITERAL ? "'" + r + "'" : r) + ")")
                   .orElse(kind.label());
    }

    /**
     * Indented multi-line rendering, two spaces per level.
     */
    public String render() {
        var sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth))
          .append(label())
          .append('\n');
        for (var child : children) {
            child.render(sb, depth + 1);
        }
    }

    private static final class Representation implements Node.Visitor<Optional<String>> {
        private static final Representation INSTANCE = new Representation();

        @Override
        public Optional<String> visitLiteral(Node.Literal node) {
            return Optional.of(String.valueOf(node.ch()));
        }

        @Override
        public Optional<String> visitCharClass(Node.CharClass node) {
            var members = node.chars()
                              .stream()
                              .sorted()
                              .map(String::valueOf)
                              .collect(Collectors.joining());
            return Optional.of("[" + (node.negated() ? "^" : "") + members + "]");
        }

        @Override
        public Optional<String> visitDot(Node.Dot node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitStart(Node.Start node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitEnd(Node.End node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitSequence(Node.Sequence node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitAlternation(Node.Alternation node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitStar(Node.Star node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitPlus(Node.Plus node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitQuestion(Node.Question node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitLazyStar(Node.LazyStar node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitLazyPlus(Node.LazyPlus node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitLazyQuestion(Node.LazyQuestion node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitNonCaptureGroup(Node.NonCaptureGroup node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitLookahead(Node.Lookahead node) {
            return Optional.empty();
        }

        @Override
        public Optional<String> visitLookbehind(Node.Lookbehind node) {
            return Optional.empty();
        }
    }
}
