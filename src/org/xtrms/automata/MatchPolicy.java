/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The built in {@linkplain SymbolSelector symbol selection} policies.
 */
public enum MatchPolicy implements SymbolSelector {

    /**
     * The default. Candidates are tried longest first (ties by text) and the
     * first whose text prefixes the remaining input is the only one taken.
     * This is a greedy policy: an NFA following it does not branch over
     * symbol choice, and may reject input that some other choice of symbols
     * would accept.
     */
    LONGEST_MATCH {
        public List<Symbol> select(Collection<Symbol> candidates, String input, int position) {
            for (Symbol symbol : sorted(candidates)) {
                if (symbol.isPrefixOf(input, position)) {
                    return Collections.singletonList(symbol);
                }
            }
            return Collections.emptyList();
        }
    },

    /**
     * Every candidate whose text prefixes the remaining input is taken, so
     * nondeterministic automata explore all symbol choices. Deterministic
     * transducers still follow only the first (longest) one.
     */
    ALL_MATCHES {
        public List<Symbol> select(Collection<Symbol> candidates, String input, int position) {
            List<Symbol> ret = new ArrayList<Symbol>();
            for (Symbol symbol : sorted(candidates)) {
                if (symbol.isPrefixOf(input, position)) {
                    ret.add(symbol);
                }
            }
            return ret;
        }
    };

    private static List<Symbol> sorted(Collection<Symbol> candidates) {
        List<Symbol> ret = new ArrayList<Symbol>(candidates.size());
        for (Symbol symbol : candidates) {
            if (!symbol.isEpsilon()) ret.add(symbol);
        }
        Collections.sort(ret, Symbol.LONGEST_FIRST);
        return ret;
    }
}
