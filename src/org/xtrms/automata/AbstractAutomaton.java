/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.xtrms.automata.AutomatonException.NameConflictException;
import org.xtrms.automata.AutomatonException.UnknownStateException;

/**
 * State bookkeeping common to every kind of automaton: the state set (kept in
 * insertion order), the start state, and the {@link SymbolSelector} used by
 * simulations. Subclasses own the transitions and are told, through
 * {@link #purge(String)} and {@link #rename(String, String)}, when a state goes
 * away or changes its name.
 * <p>
 * Instances are <em>not</em> thread safe.
 */
public abstract class AbstractAutomaton {

    final Set<String> states = new LinkedHashSet<String>();
    String startState;
    SymbolSelector selector = MatchPolicy.LONGEST_MATCH;

    AbstractAutomaton() {
    }

    public final Set<String> states() {
        return Collections.unmodifiableSet(states);
    }

    public final boolean containsState(String state) {
        return states.contains(state);
    }

    /**
     * @return the start state, or null if there is none
     */
    public final String startState() {
        return startState;
    }

    /**
     * Makes {@code state} the start state, replacing any previous one.
     */
    public final void setStartState(String state) {
        requireState(state);
        startState = state;
    }

    /*
     * Undoes the automatic start of doAddState.
     */
    final void clearStartState() {
        startState = null;
    }

    public final SymbolSelector selector() {
        return selector;
    }

    public final void setSelector(SymbolSelector selector) {
        if (selector == null) throw new IllegalArgumentException("selector");
        this.selector = selector;
    }

    /*
     * The first state of an automaton without a start state becomes the start.
     */
    final boolean doAddState(String state) {
        checkName(state);
        boolean added = states.add(state);
        if (startState == null) {
            startState = state;
        }
        return added;
    }

    /**
     * Removes {@code state} together with every transition into or out of it,
     * and any start or final flag it carries. Unknown states are ignored.
     */
    public final void removeState(String state) {
        if (!states.remove(state)) return;
        if (state.equals(startState)) {
            startState = null;
        }
        purge(state);
    }

    /**
     * Renames a state everywhere it appears.
     *
     * @throws UnknownStateException if {@code from} is not a state
     * @throws NameConflictException if {@code to} names a different state
     */
    public final void renameState(String from, String to) {
        requireState(from);
        checkName(to);
        if (from.equals(to)) return;
        if (states.contains(to)) {
            throw new NameConflictException(to);
        }
        List<String> order = new ArrayList<String>(states);
        order.set(order.indexOf(from), to);
        states.clear();
        states.addAll(order);
        if (from.equals(startState)) {
            startState = to;
        }
        rename(from, to);
    }

    /**
     * Drop every reference to a state which has already left the state set.
     */
    abstract void purge(String state);

    /**
     * Replace every reference to {@code from} by {@code to}.
     */
    abstract void rename(String from, String to);

    final void requireState(String state) {
        if (state == null || !states.contains(state)) {
            throw new UnknownStateException(state);
        }
    }

    static void checkName(String state) {
        if (state == null || state.length() == 0) {
            throw new IllegalArgumentException("state name must be non-empty");
        }
    }

    final void copyStatesTo(AbstractAutomaton copy) {
        copy.states.addAll(states);
        copy.startState = startState;
        copy.selector = selector;
    }

    final boolean statesEqual(AbstractAutomaton o) {
        return states.equals(o.states)
            && (startState == null ? o.startState == null : startState.equals(o.startState));
    }

    final int statesHashCode() {
        return 31 * states.hashCode() + (startState == null ? 0 : startState.hashCode());
    }
}
