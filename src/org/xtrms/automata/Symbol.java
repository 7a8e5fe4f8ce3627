/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A transition label: either a non-empty string, or the distinguished
 * {@link #EPSILON} symbol which consumes no input. Symbols are not restricted
 * to single characters; a multi-character symbol consumes its whole text in
 * one step.
 * <p>
 * Instances are immutable. Epsilon compares less than, and is never equal to,
 * any text symbol.
 * <p>
 * The characters {@code &} and {@code ε} are reserved: saved documents use
 * them to spell epsilon, so no symbol text may contain them.
 */
public final class Symbol implements Comparable<Symbol> {

    /**
     * The empty move. Consumes no input, pushes or pops nothing.
     */
    public static final Symbol EPSILON = new Symbol(null);

    /**
     * Orders symbols longest first, ties broken by text. Epsilon sorts last.
     */
    public static final Comparator<Symbol> LONGEST_FIRST = new Comparator<Symbol>() {
        public int compare(Symbol lhs, Symbol rhs) {
            int c = rhs.length() - lhs.length();
            return c != 0 ? c : lhs.compareTo(rhs);
        }
    };

    /*
     * Epsilon as spelled in saved documents; the second is accepted on read.
     */
    static final String EPSILON_MARKER = "&";
    static final String EPSILON_MARKER_ALT = "ε";

    private final String text;

    private Symbol(String text) {
        this.text = text;
    }

    /**
     * @param text the non-empty symbol text
     * @return the symbol
     * @throws IllegalArgumentException if {@code text} is null or empty, or
     *         contains one of the reserved characters {@code &} and {@code ε}
     */
    public static Symbol of(String text) {
        if (text == null || text.length() == 0) {
            throw new IllegalArgumentException("symbol text must be non-empty");
        }
        if (text.contains(EPSILON_MARKER) || text.contains(EPSILON_MARKER_ALT)) {
            throw new IllegalArgumentException("symbol text may not contain "
                + EPSILON_MARKER + " or " + EPSILON_MARKER_ALT + ": " + text);
        }
        return new Symbol(text);
    }

    /**
     * Whether {@code text} is one of the spellings of epsilon in saved
     * documents.
     */
    static boolean isEpsilonMarker(String text) {
        return EPSILON_MARKER.equals(text) || EPSILON_MARKER_ALT.equals(text);
    }

    public boolean isEpsilon() {
        return text == null;
    }

    /**
     * @return the symbol text
     * @throws IllegalStateException for {@link #EPSILON}
     */
    public String text() {
        if (text == null) {
            throw new IllegalStateException("epsilon has no text");
        }
        return text;
    }

    /**
     * Number of input characters consumed; zero for epsilon.
     */
    public int length() {
        return text == null ? 0 : text.length();
    }

    public boolean isSingleCharacter() {
        return length() == 1;
    }

    /**
     * Decomposes this symbol into one symbol per character. Epsilon
     * decomposes into nothing.
     */
    public List<Symbol> characters() {
        if (text == null) return Collections.emptyList();
        List<Symbol> ret = new ArrayList<Symbol>(text.length());
        for (int i = 0; i < text.length(); ++i) {
            ret.add(new Symbol(String.valueOf(text.charAt(i))));
        }
        return ret;
    }

    /**
     * Whether this symbol's text occurs in {@code input} at {@code position}.
     * Epsilon is never a prefix.
     */
    public boolean isPrefixOf(CharSequence input, int position) {
        if (text == null || position + text.length() > input.length()) {
            return false;
        }
        for (int i = 0; i < text.length(); ++i) {
            if (input.charAt(position + i) != text.charAt(i)) return false;
        }
        return true;
    }

    public int compareTo(Symbol o) {
        if (text == null) return o.text == null ? 0 : -1;
        if (o.text == null) return 1;
        return text.compareTo(o.text);
    }

    @Override
    public int hashCode() {
        return text == null ? 0 : text.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol)) return false;
        final Symbol other = (Symbol) o;
        return text == null ? other.text == null : text.equals(other.text);
    }

    @Override
    public String toString() {
        return text == null ? "ε" : text;
    }
}
