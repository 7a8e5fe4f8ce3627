/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of simulating an automaton on one input: the step by step
 * history (for stepwise display), whether the input was accepted, and how far
 * the input was consumed.
 * <p>
 * A run that could not consume its whole input is {@linkplain #stuck() stuck};
 * that is an ordinary, rejecting outcome rather than an error.
 *
 * @param <S> the type of a history entry
 */
public class Run<S> {

    private final List<S> history;
    private final boolean accepted;
    private final int consumed;
    private final int length;

    Run(List<S> history, boolean accepted, int consumed, int length) {
        assert 0 <= consumed && consumed <= length;
        this.history = Collections.unmodifiableList(new ArrayList<S>(history));
        this.accepted = accepted;
        this.consumed = consumed;
        this.length = length;
    }

    /**
     * @return the history entries in input order; empty if the automaton has
     *         no start state
     */
    public List<S> history() {
        return history;
    }

    public S last() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public boolean accepted() {
        return accepted;
    }

    /**
     * @return the furthest input position reached
     */
    public int consumed() {
        return consumed;
    }

    public int inputLength() {
        return length;
    }

    /**
     * @return true if no transition matched before the input ran out
     */
    public boolean stuck() {
        return consumed < length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(accepted ? "accepted" : stuck() ? "stuck" : "rejected")
            .append(" (").append(consumed).append('/').append(length).append(')')
            .append(LS);
        for (S step : history) {
            sb.append("    ").append(step).append(LS);
        }
        return sb.toString();
    }
}
