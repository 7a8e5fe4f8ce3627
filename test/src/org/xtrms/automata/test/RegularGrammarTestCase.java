/*
 * @LICENSE@
 */
package org.xtrms.automata.test;

import static org.xtrms.automata.AutomatonAssert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.xtrms.automata.AbstractAutomatonTestCase;
import org.xtrms.automata.AutomatonException.PreconditionException;
import org.xtrms.automata.FiniteAutomaton;
import org.xtrms.automata.Production;
import org.xtrms.automata.RegularGrammar;

public class RegularGrammarTestCase extends AbstractAutomatonTestCase {

    private static final String LS = System.getProperty("line.separator");

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegularGrammarTestCase.class);
    }

    public RegularGrammarTestCase(String name) {
        super(name);
    }

    private static List<String> rules(RegularGrammar g, String nonterminal) {
        List<String> ret = new ArrayList<String>();
        for (Production p : g.productionsFor(nonterminal)) {
            ret.add(p.toString());
        }
        return ret;
    }

    public void testFromTextbookNfa() {
        FiniteAutomaton nfa = abbNfa();
        RegularGrammar g = nfa.toRegularGrammar(false);
        logger.log(level, g.toString());

        assertEquals("0", g.start());
        assertEquals(Arrays.asList("0", "1", "2", "3"), Arrays.asList(g.nonterminals().toArray()));
        assertEquals(Arrays.asList("0 -> a 0", "0 -> a 1", "0 -> b 0"), rules(g, "0"));
        assertEquals(Arrays.asList("2 -> b 3", "2 -> b"), rules(g, "2"));
        assertEquals(Arrays.asList("3 -> ε"), rules(g, "3"));
        assertTrue(g.isStrict());
        assertEquals(Arrays.asList(sym("a"), sym("b")), Arrays.asList(g.terminals().toArray()));
        assertSameLanguage(nfa, g, "ab", 7);
    }

    public void testEpsilonMovesFolded() {
        FiniteAutomaton nfa = fa("q0", "q1", "q2");
        nfa.setFinal("q2", true);
        nfa.addTransition("q0", EPS, "q1");
        nfa.addTransition("q1", "a", "q2");

        RegularGrammar g = nfa.toRegularGrammar(false);
        assertEquals(
            "q0 -> a q2 | a" + LS +
            "q1 -> a q2 | a" + LS +
            "q2 -> ε" + LS,
            g.toString());
        assertTrue(g.accepts("a"));
        assertFalse(g.accepts(""));
        assertFalse(g.accepts("aa"));
    }

    public void testEpsilonReachableFinal() {
        FiniteAutomaton nfa = fa("q0", "q1");
        nfa.setFinal("q1", true);
        nfa.addTransition("q0", EPS, "q1");
        RegularGrammar g = nfa.toRegularGrammar(false);
        assertEquals(Arrays.asList("q0 -> ε"), rules(g, "q0"));
        assertTrue(g.accepts(""));
    }

    public void testMultiCharacterTerminals() {
        FiniteAutomaton nfa = fa("q0", "q1");
        nfa.setFinal("q1", true);
        nfa.addTransition("q0", "abc", "q1");

        RegularGrammar loose = nfa.toRegularGrammar(false);
        assertFalse(loose.isStrict());
        assertEquals(Arrays.asList("q0 -> abc q1", "q0 -> abc"), rules(loose, "q0"));
        assertTrue(loose.accepts("abc"));

        RegularGrammar strict = nfa.toRegularGrammar(true);
        logger.log(level, strict.toString());
        assertTrue(strict.isStrict());
        assertEquals(Arrays.asList("q0 -> a q0_1"), rules(strict, "q0"));
        assertEquals(Arrays.asList("q0_1 -> b q0_2"), rules(strict, "q0_1"));
        assertEquals(Arrays.asList("q0_2 -> c q1", "q0_2 -> c"), rules(strict, "q0_2"));
        assertTrue(strict.nonterminals().contains("q0_2"));
        assertEquals(Arrays.asList(sym("a"), sym("b"), sym("c")),
            Arrays.asList(strict.terminals().toArray()));
        assertTrue(strict.accepts("abc"));
        assertFalse(strict.accepts("ab"));
        assertFalse(strict.accepts("abcc"));
    }

    public void testFreshNamesAvoidStates() {
        FiniteAutomaton nfa = fa("q0", "q0_1");
        nfa.setFinal("q0_1", true);
        nfa.addTransition("q0", "xy", "q0_1");

        RegularGrammar g = nfa.toRegularGrammar(true);
        assertEquals(Arrays.asList("q0 -> x q0_2"), rules(g, "q0"));
        assertEquals(Arrays.asList("q0_2 -> y q0_1", "q0_2 -> y"), rules(g, "q0_2"));
        assertTrue(g.accepts("xy"));
    }

    public void testAgreesWithAutomaton() {
        FiniteAutomaton nfa = fa("s", "a", "b");
        nfa.setFinal("s", true);
        nfa.addTransition("s", "0", "s");
        nfa.addTransition("s", "1", "a");
        nfa.addTransition("a", "0", "b");
        nfa.addTransition("a", "1", "s");
        nfa.addTransition("b", "0", "a");
        nfa.addTransition("b", "1", "b");
        // binary multiples of three
        assertSameLanguage(nfa, nfa.toRegularGrammar(false), "01", 8);
        assertEquals(nfa.toRegularGrammar(false), nfa.toRegularGrammar(true));
    }

    public void testRequiresStartState() {
        FiniteAutomaton nfa = fa("q0");
        nfa.removeState("q0");
        try {
            nfa.toRegularGrammar(false);
            fail();
        } catch (PreconditionException e) {
            // expected
        }
    }
}
