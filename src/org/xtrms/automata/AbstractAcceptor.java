/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An automaton which accepts or rejects its input by the state it ends in,
 * and so carries a set of final (accepting) states.
 */
public abstract class AbstractAcceptor extends AbstractAutomaton {

    final Set<String> finalStates = new LinkedHashSet<String>();

    AbstractAcceptor() {
    }

    public final Set<String> finalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    public final boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public final void setFinal(String state, boolean accept) {
        requireState(state);
        if (accept) {
            finalStates.add(state);
        } else {
            finalStates.remove(state);
        }
    }

    /**
     * @return whether {@code state} is final after the toggle
     */
    public final boolean toggleFinal(String state) {
        setFinal(state, !finalStates.contains(state));
        return finalStates.contains(state);
    }

    /**
     * Adds a state, optionally flagging it as the start and/or a final state.
     * Adding a state that already exists only updates its flags.
     */
    public final void addState(String state, boolean start, boolean accept) {
        doAddState(state);
        if (start) {
            startState = state;
        }
        if (accept) {
            finalStates.add(state);
        }
    }

    public final void addState(String state) {
        addState(state, false, false);
    }

    @Override
    final void purge(String state) {
        finalStates.remove(state);
        purgeTransitions(state);
    }

    @Override
    final void rename(String from, String to) {
        if (finalStates.remove(from)) {
            finalStates.add(to);
        }
        renameTransitions(from, to);
    }

    abstract void purgeTransitions(String state);

    abstract void renameTransitions(String from, String to);

    final void copyAcceptorTo(AbstractAcceptor copy) {
        copyStatesTo(copy);
        copy.finalStates.addAll(finalStates);
    }

    final boolean acceptorEqual(AbstractAcceptor o) {
        return statesEqual(o) && finalStates.equals(o.finalStates);
    }

    final int acceptorHashCode() {
        return 31 * statesHashCode() + finalStates.hashCode();
    }
}
