package org.pragmatica.regex.parser;

import org.pragmatica.regex.ast.Node;
import org.pragmatica.regex.error.PatternSyntaxException;
import org.pragmatica.regex.error.SyntaxError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * Recursive descent parser for pattern syntax.
 *
 * <p>Precedence, loosest first: alternation, sequence, quantifier, atom.
 * <pre>
 * Alternation -> Sequence ('|' Alternation)?
 * Sequence    -> Factor*
 * Factor      -> Atom (('*' | '+' | '?') '?'?)?
 * Atom        -> Group | '[' Class ']' | '.' | '^' | '$' | '\' any | char
 * </pre>
 */
public final class PatternParser {
    private final String pattern;
    private int pos;

    private PatternParser(String pattern) {
        this.pattern = pattern;
        this.pos = 0;
    }

    /**
     * Parse pattern text into its AST.
     *
     * @throws PatternSyntaxException if the pattern is malformed
     */
    public static Node parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return new PatternParser(pattern).parsePattern();
    }

    private Node parsePattern() {
        var node = parseAlternation();
        if (!isAtEnd()) {
            throw error(SyntaxError.UNEXPECTED_CHARACTER, pos);
        }
        return node;
    }

    // Right-associative: a|b|c -> Alternation(a, Alternation(b, c))
    private Node parseAlternation() {
        var left = parseSequence();
        if (!isAtEnd() && peek() == '|') {
            advance();
            var right = parseAlternation();
            return new Node.Alternation(left, right);
        }
        return left;
    }

    private Node parseSequence() {
        var elements = new ArrayList<Node>();

        while (!isAtEnd() && peek() != ')' && peek() != '|') {
            elements.add(parseFactor());
        }

        if (elements.size() == 1) {
            return elements.get(0);
        }
        return new Node.Sequence(elements);
    }

    private Node parseFactor() {
        var atom = parseAtom();
        if (isAtEnd()) {
            return atom;
        }

        return switch (peek()) {
            case '*' -> {
                advance();
                yield consumeLazyMarker() ? new Node.LazyStar(atom) : new Node.Star(atom);
            }
            case '+' -> {
                advance();
                yield consumeLazyMarker() ? new Node.LazyPlus(atom) : new Node.Plus(atom);
            }
            case '?' -> {
                advance();
                yield consumeLazyMarker() ? new Node.LazyQuestion(atom) : new Node.Question(atom);
            }
            default -> atom;
        };
    }

    private boolean consumeLazyMarker() {
        if (!isAtEnd() && peek() == '?') {
            advance();
            return true;
        }
        return false;
    }

    private Node parseAtom() {
        if (isAtEnd()) {
            throw error(SyntaxError.UNEXPECTED_END, pos);
        }

        char c = peek();
        return switch (c) {
            case '(' -> parseGroup();
            case '[' -> parseCharClass();
            case '.' -> {
                advance();
                yield new Node.Dot();
            }
            case '^' -> {
                advance();
                yield new Node.Start();
            }
            case '$' -> {
                advance();
                yield new Node.End();
            }
            case '\\' -> parseEscape();
            case '*', '+', '?', '|', ')', ']' -> throw error(SyntaxError.UNESCAPED_SPECIAL, pos);
            default -> {
                advance();
                yield new Node.Literal(c);
            }
        };
    }

    private Node parseGroup() {
        var open = pos;
        advance(); // skip (

        if (lookingAt("?:")) {
            pos += 2;
            return new Node.NonCaptureGroup(parseGroupBody(open));
        }
        if (lookingAt("?=")) {
            pos += 2;
            return new Node.Lookahead(parseGroupBody(open), true);
        }
        if (lookingAt("?!")) {
            pos += 2;
            return new Node.Lookahead(parseGroupBody(open), false);
        }
        if (lookingAt("?<=")) {
            pos += 3;
            return new Node.Lookbehind(parseGroupBody(open), true);
        }
        if (lookingAt("?<!")) {
            pos += 3;
            return new Node.Lookbehind(parseGroupBody(open), false);
        }
        // Plain group: nothing is captured, so no wrapper node
        return parseGroupBody(open);
    }

    private Node parseGroupBody(int open) {
        var inner = parseAlternation();
        if (isAtEnd() || peek() != ')') {
            throw error(SyntaxError.UNCLOSED_GROUP, open);
        }
        advance();
        return inner;
    }

    private Node parseCharClass() {
        var open = pos;
        advance(); // skip [
        if (isAtEnd()) {
            throw error(SyntaxError.UNEXPECTED_END, pos);
        }

        var negated = peek() == '^';
        if (negated) {
            advance();
        }

        var chars = new LinkedHashSet<Character>();
        while (!isAtEnd() && peek() != ']') {
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) {
                    throw error(SyntaxError.DANGLING_ESCAPE, pos - 1);
                }
                c = advance();
            }
            chars.add(c);
        }

        if (isAtEnd()) {
            throw error(SyntaxError.UNCLOSED_CHAR_CLASS, open);
        }
        advance(); // skip ]
        return new Node.CharClass(chars, negated);
    }

    // Every escape is literal: \d is the letter 'd', \. is a dot character
    private Node parseEscape() {
        advance(); // skip backslash
        if (isAtEnd()) {
            throw error(SyntaxError.DANGLING_ESCAPE, pos - 1);
        }
        return new Node.Literal(advance());
    }

    private boolean isAtEnd() {
        return pos >= pattern.length();
    }

    private char peek() {
        return pattern.charAt(pos);
    }

    private char advance() {
        return pattern.charAt(pos++);
    }

    private boolean lookingAt(String prefix) {
        return pattern.startsWith(prefix, pos);
    }

    private PatternSyntaxException error(SyntaxError reason, int offset) {
        return new PatternSyntaxException(pattern, reason, offset);
    }
}
