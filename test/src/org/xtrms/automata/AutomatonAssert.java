/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers for building automata and comparing their languages.
 */
public final class AutomatonAssert {

    private AutomatonAssert() {}   // not instantiable.

    public static final Symbol EPS = Symbol.EPSILON;

    public static Symbol sym(String text) {
        return Symbol.of(text);
    }

    /*
     * Builders
     */

    /**
     * States are added in the given order, so the first becomes the start.
     */
    public static FiniteAutomaton fa(String... states) {
        FiniteAutomaton ret = new FiniteAutomaton();
        for (String s : states) {
            ret.addState(s);
        }
        return ret;
    }

    /**
     * {@code (a|b)*abb}, the classic textbook NFA.
     */
    public static FiniteAutomaton abbNfa() {
        FiniteAutomaton nfa = fa("0", "1", "2", "3");
        nfa.setFinal("3", true);
        nfa.addTransition("0", "a", "0");
        nfa.addTransition("0", "b", "0");
        nfa.addTransition("0", "a", "1");
        nfa.addTransition("1", "b", "2");
        nfa.addTransition("2", "b", "3");
        return nfa;
    }

    /**
     * Balanced parentheses, accepting by reaching "f" with only Z left.
     */
    public static PushdownAutomaton parenPda() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("q");
        pda.addState("f", false, true);
        pda.addTransition("q", sym("("), EPS, "q", sym("("));
        pda.addTransition("q", sym(")"), sym("("), "q", EPS);
        pda.addTransition("q", EPS, sym("Z"), "f", sym("Z"));
        return pda;
    }

    /*
     * Languages
     */

    /**
     * @return every word over {@code alphabet} (one symbol per character) of
     *         length at most {@code maxLength}, shortest first
     */
    public static List<String> words(String alphabet, int maxLength) {
        List<String> ret = new ArrayList<String>();
        ret.add("");
        int from = 0;
        for (int len = 1; len <= maxLength; ++len) {
            int to = ret.size();
            for (int i = from; i < to; ++i) {
                for (char c : alphabet.toCharArray()) {
                    ret.add(ret.get(i) + c);
                }
            }
            from = to;
        }
        return ret;
    }

    public static void assertAccepts(FiniteAutomaton fa, String... inputs) {
        for (String input : inputs) {
            assertTrue("should accept \"" + input + "\"", fa.simulate(input));
        }
    }

    public static void assertRejects(FiniteAutomaton fa, String... inputs) {
        for (String input : inputs) {
            assertFalse("should reject \"" + input + "\"", fa.simulate(input));
        }
    }

    public static void assertSameLanguage(
            FiniteAutomaton expected, FiniteAutomaton actual, String alphabet, int maxLength) {
        for (String w : words(alphabet, maxLength)) {
            assertEquals("on \"" + w + "\"", expected.simulate(w), actual.simulate(w));
        }
    }

    public static void assertSameLanguage(
            FiniteAutomaton fa, RegularGrammar grammar, String alphabet, int maxLength) {
        for (String w : words(alphabet, maxLength)) {
            assertEquals("on \"" + w + "\"", fa.simulate(w), grammar.accepts(w));
        }
    }
}
