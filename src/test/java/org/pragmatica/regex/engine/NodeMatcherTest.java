package org.pragmatica.regex.engine;

import org.junit.jupiter.api.Test;
import org.pragmatica.regex.ast.Node;
import org.pragmatica.regex.parser.PatternParser;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeMatcherTest {

    private final NodeMatcher matcher = NodeMatcher.create();

    private static Node lit(char c) {
        return new Node.Literal(c);
    }

    private List<Integer> candidates(Node node, String text, int pos) {
        return matcher.candidates(node, text, pos);
    }

    private List<Integer> candidates(String pattern, String text, int pos) {
        return matcher.candidates(PatternParser.parse(pattern), text, pos);
    }

    // === Terminals ===

    @Test
    void literal_matchesOnlyItsCharacter() {
        assertThat(candidates(lit('a'), "abc", 0)).containsExactly(1);
        assertThat(candidates(lit('a'), "abc", 1)).isEmpty();
        assertThat(candidates(lit('a'), "abc", 3)).isEmpty();
    }

    @Test
    void dot_matchesAnyCharacterIncludingNewline() {
        assertThat(candidates(new Node.Dot(), "\n", 0)).containsExactly(1);
        assertThat(candidates(new Node.Dot(), "x", 1)).isEmpty();
    }

    @Test
    void charClass_respectsNegation() {
        var negated = new Node.CharClass(Set.of('a', 'b'), true);

        assertThat(candidates(negated, "ac", 0)).isEmpty();
        assertThat(candidates(negated, "ac", 1)).containsExactly(2);
        assertThat(candidates(negated, "ac", 2)).isEmpty();
    }

    @Test
    void anchors_matchOnlyAtTextBoundaries() {
        assertThat(candidates(new Node.Start(), "abc", 0)).containsExactly(0);
        assertThat(candidates(new Node.Start(), "abc", 1)).isEmpty();
        assertThat(candidates(new Node.End(), "abc", 3)).containsExactly(3);
        assertThat(candidates(new Node.End(), "abc", 2)).isEmpty();
        assertThat(candidates(new Node.End(), "", 0)).containsExactly(0);
    }

    // === Combinators ===

    @Test
    void emptySequence_yieldsCurrentPosition() {
        assertThat(candidates(new Node.Sequence(List.of()), "abc", 2)).containsExactly(2);
    }

    @Test
    void sequence_backtracksIntoEarlierElements() {
        assertThat(candidates("a*ab", "aaab", 0)).containsExactly(4);
    }

    @Test
    void alternation_offersLeftBeforeRight() {
        assertThat(candidates("ab|a", "ab", 0)).containsExactly(2, 1);
        assertThat(candidates("a|ab", "ab", 0)).containsExactly(1, 2);
    }

    // === Repetition ===

    @Test
    void star_yieldsAscendingRepetitionCounts() {
        assertThat(candidates("a*", "aaab", 0)).containsExactly(0, 1, 2, 3);
        assertThat(candidates("a*", "bbb", 0)).containsExactly(0);
    }

    @Test
    void plus_requiresOneRepetition() {
        assertThat(candidates("a+", "aaab", 0)).containsExactly(1, 2, 3);
        assertThat(candidates("a+", "b", 0)).isEmpty();
    }

    @Test
    void plus_overEmptyMatchingChild_stepsPastEmptyCandidates() {
        // Each first repetition is extended with the child's first candidate that consumes input
        assertThat(candidates("(a?)+", "aa", 0)).containsExactly(0, 1, 2, 1, 2);
    }

    @Test
    void question_yieldsZeroThenOne() {
        assertThat(candidates("a?", "ab", 0)).containsExactly(0, 1);
        assertThat(candidates("a?", "b", 0)).containsExactly(0);
    }

    @Test
    void star_commitsToFirstCandidateOfEachRepetition() {
        // The longer alternative is never revisited once 'a' was taken
        assertThat(candidates("(a|ab)*", "abab", 0)).containsExactly(0, 1);
    }

    @Test
    void star_overEmptyMatchingChild_stepsPastEmptyCandidates() {
        assertThat(candidates("(a*)*", "aa", 0)).containsExactly(0, 1, 2);
        assertThat(candidates("(a|b?)*", "ab", 0)).containsExactly(0, 1, 2);
        assertThat(candidates("(a*)*", "bb", 0)).containsExactly(0);
    }

    @Test
    void lazyStar_matchesGreedyOrder() {
        assertThat(candidates("a*?", "aaa", 0)).containsExactly(0, 1, 2, 3);
        assertThat(candidates("a*?", "aaa", 0)).isEqualTo(candidates("a*", "aaa", 0));
    }

    @Test
    void lazyStar_overEmptyMatchingChild_terminates() {
        assertThat(candidates("(a?)*?", "aa", 0)).containsExactly(0, 1, 2);
    }

    @Test
    void lazyPlus_offersEachPositionInAscendingOrder() {
        // The zero-repetition tail re-offers the position of the first repetition
        assertThat(candidates("a+?", "aaa", 0)).containsExactly(1, 1, 2, 3);
        assertThat(candidates("a+?", "b", 0)).isEmpty();
    }

    @Test
    void lazyQuestion_matchesQuestion() {
        assertThat(candidates("a??", "a", 0)).containsExactly(0, 1);
    }

    @Test
    void nonCaptureGroup_delegatesToChild() {
        assertThat(candidates("(?:ab|a)", "ab", 0)).containsExactly(2, 1);
    }

    // === Assertions ===

    @Test
    void lookahead_isZeroWidth() {
        assertThat(candidates("(?=b)", "ab", 1)).containsExactly(1);
        assertThat(candidates("(?=b)", "ab", 0)).isEmpty();
        assertThat(candidates("(?!b)", "ab", 0)).containsExactly(0);
        assertThat(candidates("(?!b)", "ab", 1)).isEmpty();
    }

    @Test
    void lookahead_acceptsEmptyMatchAtTextStart() {
        assertThat(candidates("(?=a*)", "", 0)).containsExactly(0);
    }

    @Test
    void lookbehind_isZeroWidth() {
        assertThat(candidates("(?<=a)", "ab", 1)).containsExactly(1);
        assertThat(candidates("(?<=a)", "ab", 0)).isEmpty();
        assertThat(candidates("(?<!x)", "ab", 1)).containsExactly(1);
        assertThat(candidates("(?<!a)", "ab", 1)).isEmpty();
    }

    @Test
    void lookbehind_scansUnboundedPrefixes() {
        assertThat(candidates("(?<=^a.*)", "a123", 4)).containsExactly(4);
        assertThat(candidates("(?<=^b.*)", "a123", 4)).isEmpty();
    }

    @Test
    void lookbehind_emptyChildMatchesAtStart() {
        assertThat(candidates("(?<=a*)", "", 0)).containsExactly(0);
    }

    // === Helpers ===

    @Test
    void firstCandidate_returnsFirstOrMinusOne() {
        var node = PatternParser.parse("a*");

        assertEquals(0, matcher.firstCandidate(node, "aaa", 0));
        assertEquals(-1, matcher.firstCandidate(lit('x'), "aaa", 0));
    }

    @Test
    void matchesAt_reportsExistence() {
        assertTrue(matcher.matchesAt(lit('a'), "a", 0));
        assertFalse(matcher.matchesAt(lit('a'), "b", 0));
    }

    @Test
    void produce_stopsWhenSinkAsks() {
        var seen = new StringBuilder();

        var stopped = matcher.produce(PatternParser.parse("a*"), "aaa", 0, end -> {
            seen.append(end);
            return end == 2;
        });

        assertTrue(stopped);
        assertEquals("012", seen.toString());
    }

    @Test
    void produce_withListener_enumeratesSameCandidates() {
        var traced = NodeMatcher.create(TraceRecorder.create());
        var node = PatternParser.parse("(a|b)*c?(?<=b)");

        assertEquals(matcher.candidates(node, "abbc", 0), traced.candidates(node, "abbc", 0));
    }
}
