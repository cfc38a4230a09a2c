package org.pragmatica.regex.engine;

import org.pragmatica.regex.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Backtracking driver - enumerates the end positions each node can reach from a start position.
 *
 * <p>Every node offers its candidates one at a time through an {@link EndPositionSink}. A sink
 * that rejects a candidate makes the node try its next alternative, which is how backtracking
 * happens: a sequence rejects an element's candidate when the rest of the sequence cannot
 * follow it. Nothing is cached between calls, so patterns with nested unbounded quantifiers
 * can take exponential time. Lazy quantifiers recurse once per repetition, so a lazy
 * repetition spanning tens of thousands of characters can exhaust the thread stack.
 *
 * <p>Quantifiers offer candidates in ascending repetition count. Lazy quantifiers use a
 * different recursion but end up with the same order for single-step children.
 *
 * <p>Instances are immutable. Sharing one between threads is safe as long as the listener is.
 */
public final class NodeMatcher {
    private static final int NO_MATCH = -1;

    private final MatchListener listener;

    private NodeMatcher(MatchListener listener) {
        this.listener = listener;
    }

    public static NodeMatcher create() {
        return new NodeMatcher(MatchListener.NONE);
    }

    public static NodeMatcher create(MatchListener listener) {
        return new NodeMatcher(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Offer every candidate end position of {@code node} at {@code pos} to the sink, in order.
     *
     * @return {@code true} if the sink stopped the enumeration
     */
    public boolean produce(Node node, String text, int pos, EndPositionSink sink) {
        if (listener == MatchListener.NONE) {
            return node.accept(new Step(text, pos, sink));
        }

        listener.enter(node, pos);
        var stopped = node.accept(new Step(text, pos, end -> {
            listener.candidate(node, pos, end);
            return sink.accept(end);
        }));
        if (!stopped) {
            listener.exit(node, pos);
        }
        return stopped;
    }

    /**
     * First candidate end position of {@code node} at {@code pos}, or -1 if there is none.
     */
    public int firstCandidate(Node node, String text, int pos) {
        var found = new int[]{NO_MATCH};
        produce(node, text, pos, end -> {
            found[0] = end;
            return true;
        });
        return found[0];
    }

    /**
     * Whether {@code node} has any candidate at {@code pos}.
     */
    public boolean matchesAt(Node node, String text, int pos) {
        return produce(node, text, pos, end -> true);
    }

    /**
     * All candidate end positions of {@code node} at {@code pos}, in enumeration order.
     */
    public List<Integer> candidates(Node node, String text, int pos) {
        var result = new ArrayList<Integer>();
        produce(node, text, pos, end -> {
            result.add(end);
            return false;
        });
        return result;
    }

    // === Terminals ===

    private static boolean matchLiteral(Node.Literal literal, String text, int pos, EndPositionSink sink) {
        if (pos < text.length() && text.charAt(pos) == literal.ch()) {
            return sink.accept(pos + 1);
        }
        return false;
    }

    private static boolean matchDot(String text, int pos, EndPositionSink sink) {
        if (pos < text.length()) {
            return sink.accept(pos + 1);
        }
        return false;
    }

    private static boolean matchCharClass(Node.CharClass charClass, String text, int pos, EndPositionSink sink) {
        if (pos < text.length() && charClass.matches(text.charAt(pos))) {
            return sink.accept(pos + 1);
        }
        return false;
    }

    private static boolean matchStart(int pos, EndPositionSink sink) {
        return pos == 0 && sink.accept(pos);
    }

    private static boolean matchEnd(String text, int pos, EndPositionSink sink) {
        return pos == text.length() && sink.accept(pos);
    }

    // === Combinators ===

    private boolean matchSequence(List<Node> elements, int index, String text, int pos, EndPositionSink sink) {
        if (index == elements.size()) {
            return sink.accept(pos);
        }
        return produce(elements.get(index), text, pos,
                       mid -> matchSequence(elements, index + 1, text, mid, sink));
    }

    private boolean matchAlternation(Node.Alternation alternation, String text, int pos, EndPositionSink sink) {
        return produce(alternation.left(), text, pos, sink)
               || produce(alternation.right(), text, pos, sink);
    }

    // === Repetition ===

    private boolean matchStar(Node.Star star, String text, int pos, EndPositionSink sink) {
        return sink.accept(pos) || repeat(star.node(), text, pos, sink);
    }

    private boolean matchPlus(Node.Plus plus, String text, int pos, EndPositionSink sink) {
        return produce(plus.node(), text, pos,
                       first -> sink.accept(first) || repeat(plus.node(), text, first, sink));
    }

    /**
     * Extend a repetition one step at a time, always committing to the child's first candidate
     * that consumes input. Stops when the child has no such candidate.
     */
    private boolean repeat(Node child, String text, int from, EndPositionSink sink) {
        var current = from;
        while (true) {
            var next = firstAdvancingCandidate(child, text, current);
            if (next == NO_MATCH) {
                return false;
            }
            if (sink.accept(next)) {
                return true;
            }
            current = next;
        }
    }

    private int firstAdvancingCandidate(Node child, String text, int pos) {
        var found = new int[]{NO_MATCH};
        produce(child, text, pos, end -> {
            if (end > pos) {
                found[0] = end;
                return true;
            }
            return false;
        });
        return found[0];
    }

    private boolean matchQuestion(Node child, String text, int pos, EndPositionSink sink) {
        return sink.accept(pos) || produce(child, text, pos, sink);
    }

    private boolean matchLazyStar(Node.LazyStar lazyStar, String text, int pos, EndPositionSink sink) {
        if (sink.accept(pos)) {
            return true;
        }
        return produce(lazyStar.node(), text, pos,
                       mid -> mid != pos && produce(lazyStar, text, mid, sink));
    }

    private boolean matchLazyPlus(Node.LazyPlus lazyPlus, String text, int pos, EndPositionSink sink) {
        var child = lazyPlus.node();
        return produce(child, text, pos,
                       mid -> sink.accept(mid) || (mid != pos && lazyTail(child, text, mid, sink)));
    }

    // Zero-or-more tail of a lazy plus; the zero case repeats the position the plus just offered
    private boolean lazyTail(Node child, String text, int pos, EndPositionSink sink) {
        if (sink.accept(pos)) {
            return true;
        }
        return produce(child, text, pos,
                       mid -> mid != pos && lazyTail(child, text, mid, sink));
    }

    // === Assertions ===

    private boolean matchLookahead(Node.Lookahead lookahead, String text, int pos, EndPositionSink sink) {
        var found = matchesAt(lookahead.node(), text, pos);
        return found == lookahead.positive() && sink.accept(pos);
    }

    // Tries every start in [0, pos]; cost grows with the position
    private boolean matchLookbehind(Node.Lookbehind lookbehind, String text, int pos, EndPositionSink sink) {
        var found = false;
        for (int start = 0; start <= pos && !found; start++) {
            found = produce(lookbehind.node(), text, start, end -> end == pos);
        }
        return found == lookbehind.positive() && sink.accept(pos);
    }

    /**
     * One node evaluation at a fixed text position.
     */
    private final class Step implements Node.Visitor<Boolean> {
        private final String text;
        private final int pos;
        private final EndPositionSink sink;

        private Step(String text, int pos, EndPositionSink sink) {
            this.text = text;
            this.pos = pos;
            this.sink = sink;
        }

        @Override
        public Boolean visitLiteral(Node.Literal node) {
            return matchLiteral(node, text, pos, sink);
        }

        @Override
        public Boolean visitDot(Node.Dot node) {
            return matchDot(text, pos, sink);
        }

        @Override
        public Boolean visitCharClass(Node.CharClass node) {
            return matchCharClass(node, text, pos, sink);
        }

        @Override
        public Boolean visitStart(Node.Start node) {
            return matchStart(pos, sink);
        }

        @Override
        public Boolean visitEnd(Node.End node) {
            return matchEnd(text, pos, sink);
        }

        @Override
        public Boolean visitSequence(Node.Sequence node) {
            return matchSequence(node.elements(), 0, text, pos, sink);
        }

        @Override
        public Boolean visitAlternation(Node.Alternation node) {
            return matchAlternation(node, text, pos, sink);
        }

        @Override
        public Boolean visitStar(Node.Star node) {
            return matchStar(node, text, pos, sink);
        }

        @Override
        public Boolean visitPlus(Node.Plus node) {
            return matchPlus(node, text, pos, sink);
        }

        @Override
        public Boolean visitQuestion(Node.Question node) {
            return matchQuestion(node.node(), text, pos, sink);
        }

        @Override
        public Boolean visitLazyStar(Node.LazyStar node) {
            return matchLazyStar(node, text, pos, sink);
        }

        @Override
        public Boolean visitLazyPlus(Node.LazyPlus node) {
            return matchLazyPlus(node, text, pos, sink);
        }

        @Override
        public Boolean visitLazyQuestion(Node.LazyQuestion node) {
            return matchQuestion(node.node(), text, pos, sink);
        }

        @Override
        public Boolean visitNonCaptureGroup(Node.NonCaptureGroup node) {
            return produce(node.node(), text, pos, sink);
        }

        @Override
        public Boolean visitLookahead(Node.Lookahead node) {
            return matchLookahead(node, text, pos, sink);
        }

        @Override
        public Boolean visitLookbehind(Node.Lookbehind node) {
            return matchLookbehind(node, text, pos, sink);
        }
    }
}
