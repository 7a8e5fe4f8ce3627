/*
 * @LICENSE@
 */
package org.xtrms.automata.test;

import static org.xtrms.automata.AutomatonAssert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import org.xtrms.automata.AbstractAutomatonTestCase;
import org.xtrms.automata.AutomatonException.ResourceExhaustedException;
import org.xtrms.automata.AutomatonException.UnknownStateException;
import org.xtrms.automata.PushdownAutomaton;
import org.xtrms.automata.PushdownAutomaton.Configuration;
import org.xtrms.automata.Run;

public class PushdownAutomatonTestCase extends AbstractAutomatonTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PushdownAutomatonTestCase.class);
    }

    public PushdownAutomatonTestCase(String name) {
        super(name);
    }

    private PushdownAutomaton parens;

    protected void setUp() throws Exception {
        super.setUp();
        parens = parenPda();
    }

    protected void tearDown() throws Exception {
        parens = null;
        super.tearDown();
    }

    /*
     * a^n b^n, n >= 0
     */
    private static PushdownAutomaton anbn() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("push");
        pda.addState("pop");
        pda.addState("accept", false, true);
        pda.addTransition("push", sym("a"), EPS, "push", sym("A"));
        pda.addTransition("push", sym("b"), sym("A"), "pop", EPS);
        pda.addTransition("pop", sym("b"), sym("A"), "pop", EPS);
        pda.addTransition("push", EPS, sym("Z"), "accept", EPS);
        pda.addTransition("pop", EPS, sym("Z"), "accept", EPS);
        return pda;
    }

    public void testBalancedParentheses() {
        assertTrue(parens.simulate("(())"));
        assertTrue(parens.simulate("()()"));
        assertTrue(parens.simulate(""));
        assertFalse(parens.simulate("(()"));
        assertFalse(parens.simulate("())"));
        assertFalse(parens.simulate(")("));
    }

    public void testHistory() {
        Run<Configuration> run = parens.simulateHistory("(())");
        logger.log(level, run.toString());
        assertTrue(run.accepted());
        assertEquals(5, run.history().size());
        for (int i = 0; i < run.history().size(); ++i) {
            assertEquals(i, run.history().get(i).position());
        }
        Configuration first = run.history().get(0);
        assertEquals("q", first.state());
        assertEquals(Collections.singletonList("Z"), first.stack());
        assertEquals(Arrays.asList("Z", "(", "("), run.history().get(2).stack());
        assertEquals("(", run.history().get(2).top());
    }

    public void testStuckAndRejected() {
        Run<Configuration> stuck = parens.simulateHistory(")(");
        assertFalse(stuck.accepted());
        assertTrue(stuck.stuck());
        assertEquals(0, stuck.consumed());

        Run<Configuration> rejected = parens.simulateHistory("(()");
        assertFalse(rejected.accepted());
        assertFalse(rejected.stuck());
        assertEquals(3, rejected.consumed());
    }

    public void testCountingLanguage() {
        PushdownAutomaton pda = anbn();
        for (String w : new String[] { "", "ab", "aabb", "aaabbb" }) {
            assertTrue(w, pda.simulate(w));
        }
        for (String w : new String[] { "a", "b", "aab", "abb", "abab", "ba" }) {
            assertFalse(w, pda.simulate(w));
        }
    }

    public void testPushOrder() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("p");
        pda.addState("r", false, true);
        pda.addTransition("p", sym("x"), EPS, "r", sym("AB"));
        Run<Configuration> run = pda.simulateHistory("x");
        assertTrue(run.accepted());
        assertEquals(Arrays.asList("Z", "A", "B"), run.last().stack());
        assertEquals("B", run.last().top());
    }

    public void testMultiCharacterInput() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("p");
        pda.addState("r", false, true);
        pda.addTransition("p", sym("ab"), EPS, "p", sym("X"));
        pda.addTransition("p", sym("a"), EPS, "p", EPS);
        pda.addTransition("p", sym("c"), sym("X"), "r", EPS);
        // "ab" wins over "a" at position 0
        assertTrue(pda.simulate("abc"));
        assertFalse(pda.simulate("ac"));
    }

    public void testClosureAndMove() {
        Configuration init = parens.initialConfiguration();
        Set<Configuration> closure = parens.epsilonClosure(Collections.singleton(init));
        assertEquals(2, closure.size());
        assertTrue(closure.contains(init));
        assertEquals(closure, parens.epsilonClosure(closure));

        Set<Configuration> moved = parens.move(closure, sym("("));
        assertEquals(1, moved.size());
        Configuration c = moved.iterator().next();
        assertEquals(1, c.position());
        assertEquals(Arrays.asList("Z", "("), c.stack());
        try {
            parens.move(closure, EPS);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testEpsilonPushLoopIsBounded() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("loop");
        pda.addTransition("loop", EPS, EPS, "loop", sym("A"));
        pda.setMaxStackDepth(64);
        try {
            pda.simulate("");
            fail();
        } catch (ResourceExhaustedException e) {
            // expected
        }
        pda.setMaxStackDepth(10 * 1000);
        pda.setMaxConfigurations(100);
        try {
            pda.simulate("a");
            fail();
        } catch (ResourceExhaustedException e) {
            // expected
        }
    }

    public void testEpsilonCycleWithoutGrowthTerminates() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("p");
        pda.addState("q");
        pda.addTransition("p", EPS, EPS, "q", EPS);
        pda.addTransition("q", EPS, EPS, "p", EPS);
        assertFalse(pda.simulate(""));
        pda.setFinal("q", true);
        assertTrue(pda.simulate(""));
    }

    public void testAlphabets() {
        assertEquals(Arrays.asList(sym("("), sym(")")), Arrays.asList(parens.inputAlphabet().toArray()));
        assertEquals(Arrays.asList("(", "Z"), Arrays.asList(parens.stackAlphabet().toArray()));
        parens.setStartStackSymbol("$");
        assertTrue(parens.stackAlphabet().contains("$"));
        assertEquals(Collections.singletonList("$"), parens.initialConfiguration().stack());
    }

    public void testStateMaintenance() {
        PushdownAutomaton pda = anbn();
        PushdownAutomaton copy = pda.copy();
        assertEquals(pda, copy);
        assertEquals(pda.hashCode(), copy.hashCode());

        copy.renameState("pop", "drain");
        assertEquals(1, copy.targets("push", sym("b"), sym("A")).size());
        assertEquals("drain", copy.targets("push", sym("b"), sym("A")).iterator().next().state());
        assertTrue(copy.simulate("aabb"));
        assertFalse(pda.equals(copy));

        copy.removeState("drain");
        assertTrue(copy.targets("push", sym("b"), sym("A")).isEmpty());
        assertTrue(copy.simulate(""));
        assertFalse(copy.simulate("ab"));

        assertTrue(pda.removeTransition("push", sym("a"), EPS, "push", sym("A")));
        assertFalse(pda.removeTransition("push", sym("a"), EPS, "push", sym("A")));
        assertFalse(pda.simulate("ab"));

        try {
            pda.addTransition("push", sym("a"), EPS, "nowhere", EPS);
            fail();
        } catch (UnknownStateException e) {
            // expected
        }
    }

    public void testNoStartState() {
        PushdownAutomaton pda = new PushdownAutomaton();
        assertNull(pda.initialConfiguration());
        Run<Configuration> run = pda.simulateHistory("");
        assertFalse(run.accepted());
        assertTrue(run.history().isEmpty());
    }

    public void testFirstStateStarts() {
        PushdownAutomaton pda = new PushdownAutomaton();
        pda.addState("a", false, true);
        pda.addState("b");
        assertEquals("a", pda.startState());
        assertTrue(pda.simulate(""));
        assertEquals(Collections.singletonList("Z"), pda.initialConfiguration().stack());
    }
}
