/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.Collection;
import java.util.List;

/**
 * Chooses which outgoing symbols a simulation follows at a given input
 * position. Because symbols may span several characters, more than one symbol
 * can match the remaining input at once; the selector decides which of them
 * are taken.
 *
 * @see MatchPolicy
 */
public interface SymbolSelector {

    /**
     * @param candidates the symbols labeling transitions out of the active
     *        states; may contain {@link Symbol#EPSILON}, which is ignored
     * @param input the whole input
     * @param position the cursor into {@code input}
     * @return the symbols to follow, each a literal prefix of the remaining
     *         input, longest first; empty when the automaton is stuck
     */
    List<Symbol> select(Collection<Symbol> candidates, String input, int position);
}
