/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deterministic finite state transducer. Subclasses supply the transition
 * function and where the output comes from; the single path run over the
 * input is implemented here.
 * <p>
 * At each position the input symbols out of the current state are offered to
 * the {@link #selector()}, and the first symbol returned is taken. If there is
 * none while input remains, the run is stuck and produces no output.
 */
public abstract class AbstractTransducer extends AbstractAutomaton {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * A history entry: the state entered, the output so far, and the input
     * position reached.
     */
    public static final class Step {

        private final String state;
        private final String output;
        private final int position;

        Step(String state, String output, int position) {
            this.state = state;
            this.output = output;
            this.position = position;
        }
        public String state() {
            return state;
        }
        public String output() {
            return output;
        }
        public int position() {
            return position;
        }
        @Override
        public String toString() {
            return position + ": " + state + " \"" + output + "\"";
        }
    }

    /**
     * A run that carries the produced output, or null if the run got stuck or
     * there was no start state.
     */
    public static final class TransducerRun extends Run<Step> {

        private final String output;

        TransducerRun(List<Step> history, String output, int consumed, int length) {
            super(history, output != null, consumed, length);
            this.output = output;
        }

        public String output() {
            return output;
        }
    }

    AbstractTransducer() {
    }

    /**
     * @return the state reached from {@code src} on {@code input}, or null
     */
    public abstract String target(String src, Symbol input);

    public String target(String src, String input) {
        return target(src, Symbol.of(input));
    }

    /**
     * @return the input symbols of the transitions out of {@code state}
     */
    abstract Set<Symbol> inputsFrom(String state);

    /**
     * Output appended when the transition {@code src --input-->} is taken.
     */
    abstract String emit(String src, Symbol input);

    /**
     * Output present before any input is read.
     */
    abstract String initialOutput(String start);

    public abstract SortedSet<Symbol> inputAlphabet();

    public abstract SortedSet<String> outputAlphabet();

    /*
     * Transducer transitions always consume input.
     */
    static void checkInput(Symbol input) {
        if (input == null || input.isEpsilon()) {
            throw new IllegalArgumentException("transducer transitions need a non-epsilon input");
        }
    }

    /*
     * An output may not be spelled like epsilon, which stands for the empty
     * output in saved documents.
     */
    static void checkOutput(String output) {
        if (output == null) throw new IllegalArgumentException("output must be non-null");
        if (Symbol.isEpsilonMarker(output)) {
            throw new IllegalArgumentException("reserved output: " + output);
        }
    }

    static SortedSet<String> outputs(Iterable<String> values) {
        SortedSet<String> ret = new TreeSet<String>();
        for (String v : values) {
            if (v.length() > 0) ret.add(v);
        }
        return ret;
    }

    /**
     * @return the output for {@code input}, or null if the run gets stuck or
     *         there is no start state
     */
    public final String simulate(String input) {
        return simulateHistory(input).output();
    }

    public final TransducerRun simulateHistory(String input) {
        final int n = input.length();
        List<Step> history = new ArrayList<Step>();
        if (startState == null) {
            return new TransducerRun(history, null, 0, n);
        }
        String state = startState;
        StringBuilder out = new StringBuilder(initialOutput(state));
        int position = 0;
        history.add(new Step(state, out.toString(), position));

        while (position < n) {
            List<Symbol> chosen = selector.select(inputsFrom(state), input, position);
            if (chosen.isEmpty()) break;
            Symbol symbol = chosen.get(0);
            out.append(emit(state, symbol));
            state = target(state, symbol);
            position += symbol.length();
            history.add(new Step(state, out.toString(), position));
        }
        TransducerRun run =
            new TransducerRun(history, position == n ? out.toString() : null, position, n);
        if (logger.isLoggable(level)) {
            logger.log(level, getClass().getSimpleName() + " \"" + input + "\": " + run);
        }
        return run;
    }
}
