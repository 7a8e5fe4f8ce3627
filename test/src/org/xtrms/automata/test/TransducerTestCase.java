/*
 * @LICENSE@
 */
package org.xtrms.automata.test;

import static org.xtrms.automata.AutomatonAssert.*;

import java.util.Arrays;

import org.xtrms.automata.AbstractAutomatonTestCase;
import org.xtrms.automata.AbstractTransducer.TransducerRun;
import org.xtrms.automata.AutomatonException.UnknownStateException;
import org.xtrms.automata.MatchPolicy;
import org.xtrms.automata.MealyMachine;
import org.xtrms.automata.MooreMachine;

public class TransducerTestCase extends AbstractAutomatonTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(TransducerTestCase.class);
    }

    public TransducerTestCase(String name) {
        super(name);
    }

    /*
     * Parity of the number of 1s read so far.
     */
    private static MooreMachine parity() {
        MooreMachine moore = new MooreMachine();
        moore.addState("even", "0");
        moore.addState("odd", "1");
        moore.addTransition("even", "0", "even");
        moore.addTransition("even", "1", "odd");
        moore.addTransition("odd", "0", "odd");
        moore.addTransition("odd", "1", "even");
        return moore;
    }

    /*
     * Echoes a as x and b as y, alternating between two states.
     */
    private static MealyMachine alternating() {
        MealyMachine mealy = new MealyMachine();
        mealy.addState("s0");
        mealy.addState("s1");
        mealy.addTransition("s0", "a", "s1", "x");
        mealy.addTransition("s1", "b", "s0", "y");
        return mealy;
    }

    public void testMooreInitialOutput() {
        MooreMachine moore = parity();
        TransducerRun run = moore.simulateHistory("");
        assertEquals(1, run.history().size());
        assertEquals("0", run.history().get(0).output());
        assertEquals("0", run.output());
        assertTrue(run.accepted());
        assertEquals("0", moore.simulate(""));
    }

    public void testMooreOutputs() {
        MooreMachine moore = parity();
        assertEquals("01001", moore.simulate("1101"));
        TransducerRun run = moore.simulateHistory("11");
        assertEquals(3, run.history().size());
        assertEquals("odd", run.history().get(1).state());
        assertEquals("01", run.history().get(1).output());
        assertEquals(2, run.last().position());
        assertEquals("010", run.last().output());
    }

    public void testMooreStuck() {
        MooreMachine moore = parity();
        TransducerRun run = moore.simulateHistory("12");
        assertNull(run.output());
        assertFalse(run.accepted());
        assertTrue(run.stuck());
        assertEquals(1, run.consumed());
        assertEquals(2, run.history().size());
        assertNull(moore.simulate("2"));
    }

    public void testMooreLongestInput() {
        MooreMachine moore = new MooreMachine();
        moore.addState("s", "");
        moore.addState("one", "1");
        moore.addState("two", "2");
        moore.addTransition("s", "a", "one");
        moore.addTransition("s", "ab", "two");
        moore.addTransition("one", "b", "s");
        moore.addTransition("two", "a", "one");
        assertEquals("2", moore.simulate("ab"));
        assertEquals("21", moore.simulate("aba"));

        // transducers follow the first selected symbol only
        moore.setSelector(MatchPolicy.ALL_MATCHES);
        assertEquals("2", moore.simulate("ab"));
    }

    public void testMooreStateMaintenance() {
        MooreMachine moore = parity();
        assertEquals("even", moore.startState());
        moore.addState("odd", "I", true);
        assertEquals("odd", moore.startState());
        assertEquals("I", moore.output("odd"));
        moore.setOutput("odd", "1");

        moore.addTransition("odd", "1", "odd");
        assertEquals("odd", moore.target("odd", "1"));
        assertTrue(moore.removeTransition("odd", sym("1")));
        assertFalse(moore.removeTransition("odd", sym("1")));
        assertNull(moore.target("odd", "1"));

        moore.renameState("odd", "o");
        assertEquals("1", moore.output("o"));
        assertEquals("o", moore.target("even", "1"));
        assertEquals("o", moore.startState());

        moore.removeState("o");
        assertNull(moore.startState());
        assertNull(moore.target("even", "1"));
        assertNull(moore.simulate("0"));

        assertEquals(Arrays.asList(sym("0")), Arrays.asList(moore.inputAlphabet().toArray()));
        assertEquals(Arrays.asList("0"), Arrays.asList(moore.outputAlphabet().toArray()));
    }

    public void testTransducerArguments() {
        MooreMachine moore = parity();
        try {
            moore.addTransition("even", EPS, "odd");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            moore.addTransition("even", "1", "nowhere");
            fail();
        } catch (UnknownStateException e) {
            // expected
        }
        try {
            moore.addState("x", null);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertFalse(moore.containsState("x"));
        try {
            moore.output("nowhere");
            fail();
        } catch (UnknownStateException e) {
            // expected
        }
        MealyMachine mealy = alternating();
        try {
            mealy.addTransition("s0", EPS, "s1", "z");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testMealyOutputs() {
        MealyMachine mealy = alternating();
        assertEquals("", mealy.simulate(""));
        assertEquals("xyxy", mealy.simulate("abab"));
        assertEquals("x", mealy.outputOf("s0", "a"));
        assertNull(mealy.outputOf("s0", "b"));
        assertEquals("s1", mealy.target("s0", "a"));

        TransducerRun run = mealy.simulateHistory("aba");
        assertEquals(4, run.history().size());
        assertEquals("xy", run.history().get(2).output());
        assertEquals("xyx", run.output());
    }

    public void testMealyStuck() {
        MealyMachine mealy = alternating();
        TransducerRun run = mealy.simulateHistory("aa");
        assertNull(run.output());
        assertTrue(run.stuck());
        assertEquals(1, run.consumed());
        assertEquals("x", run.last().output());
    }

    public void testMealyReplaceAndRemove() {
        MealyMachine mealy = alternating();
        mealy.addTransition("s0", "a", "s0", "");
        assertEquals("s0", mealy.target("s0", "a"));
        assertEquals("", mealy.simulate("aaa"));
        assertEquals(Arrays.asList("y"), Arrays.asList(mealy.outputAlphabet().toArray()));

        mealy.removeState("s0");
        assertTrue(mealy.transitions().isEmpty());
        assertNull(mealy.simulate(""));

        MealyMachine copy = alternating().copy();
        assertEquals(alternating(), copy);
        copy.renameState("s1", "t");
        assertEquals("t", copy.target("s0", "a"));
        assertEquals("xy", copy.simulate("ab"));
        assertFalse(alternating().equals(copy));
    }

    public void testMooreCopy() {
        MooreMachine moore = parity();
        MooreMachine copy = moore.copy();
        assertEquals(moore, copy);
        assertEquals(moore.hashCode(), copy.hashCode());
        copy.setOutput("odd", "one");
        assertFalse(moore.equals(copy));
        assertEquals("1", moore.output("odd"));
    }
}
