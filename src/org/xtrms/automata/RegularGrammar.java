/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A right-linear grammar, as derived from a {@link FiniteAutomaton} by
 * {@link FiniteAutomaton#toRegularGrammar(boolean)}. Immutable once built.
 */
public final class RegularGrammar {

    private final String start;
    private final Set<String> nonterminals = new LinkedHashSet<String>();
    private final Map<String, List<Production>> byLhs =
        new LinkedHashMap<String, List<Production>>();
    private final Set<Production> productions = new LinkedHashSet<Production>();
    private int fresh = 0;

    RegularGrammar(String start, Collection<String> nonterminals) {
        this.start = start;
        this.nonterminals.addAll(nonterminals);
    }

    void add(String lhs, Symbol terminal, String next) {
        Production p = new Production(lhs, terminal, next);
        if (!productions.add(p)) return;
        List<Production> list = byLhs.get(lhs);
        if (list == null) {
            byLhs.put(lhs, list = new ArrayList<Production>());
        }
        list.add(p);
    }

    /*
     * Rules for the edge lhs --terminal--> next: "lhs -> terminal next", plus
     * "lhs -> terminal" when next accepts. In strict mode a multi-character
     * terminal becomes a chain through fresh nonterminals.
     */
    void addRule(String lhs, Symbol terminal, String next, boolean accepting, boolean strict) {
        String current = lhs;
        Symbol last = terminal;
        if (strict && terminal.length() > 1) {
            List<Symbol> chars = terminal.characters();
            for (Symbol c : chars.subList(0, chars.size() - 1)) {
                String n = freshNonterminal(lhs);
                add(current, c, n);
                current = n;
            }
            last = chars.get(chars.size() - 1);
        }
        add(current, last, next);
        if (accepting) {
            add(current, last, null);
        }
    }

    private String freshNonterminal(String base) {
        String name;
        do {
            name = base + "_" + (++fresh);
        } while (nonterminals.contains(name));
        nonterminals.add(name);
        return name;
    }

    public String start() {
        return start;
    }

    public Set<String> nonterminals() {
        return Collections.unmodifiableSet(nonterminals);
    }

    /**
     * @return the non-epsilon terminals, sorted
     */
    public SortedSet<Symbol> terminals() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (Production p : productions) {
            if (!p.terminal().isEpsilon()) ret.add(p.terminal());
        }
        return ret;
    }

    public List<Production> productions() {
        return Collections.unmodifiableList(new ArrayList<Production>(productions));
    }

    public List<Production> productionsFor(String nonterminal) {
        List<Production> list = byLhs.get(nonterminal);
        return list == null
            ? Collections.<Production>emptyList()
            : Collections.unmodifiableList(list);
    }

    /**
     * @return true if every terminal is epsilon or a single character
     */
    public boolean isStrict() {
        for (Production p : productions) {
            if (p.terminal().length() > 1) return false;
        }
        return true;
    }

    /**
     * Whether {@code input} is derivable from the start symbol.
     */
    public boolean accepts(String input) {
        final int n = input.length();
        TreeMap<Integer, Set<String>> frontier = new TreeMap<Integer, Set<String>>();
        frontier.put(0, Collections.singleton(start));
        while (!frontier.isEmpty()) {
            Map.Entry<Integer, Set<String>> entry = frontier.pollFirstEntry();
            final int position = entry.getKey();
            LinkedList<String> work = new LinkedList<String>(entry.getValue());
            Set<String> seen = new HashSet<String>(work);
            while (!work.isEmpty()) {
                for (Production p : productionsFor(work.removeFirst())) {
                    Symbol t = p.terminal();
                    int to = position + t.length();
                    if (!t.isEpsilon() && !t.isPrefixOf(input, position)) continue;
                    if (p.next() == null) {
                        if (to == n) return true;
                    } else if (to == position) {
                        if (seen.add(p.next())) work.add(p.next());
                    } else {
                        Set<String> pending = frontier.get(to);
                        if (pending == null) {
                            frontier.put(to, pending = new LinkedHashSet<String>());
                        }
                        pending.add(p.next());
                    }
                }
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + productions.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegularGrammar)) return false;
        final RegularGrammar g = (RegularGrammar) o;
        return start.equals(g.start) && productions.equals(g.productions);
    }

    /**
     * One line per nonterminal with productions, alternatives joined by
     * {@code |}, e.g. {@code q0 -> a q1 | b | ε}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<Production>> e : byLhs.entrySet()) {
            sb.append(e.getKey()).append(" ->");
            String sep = " ";
            for (Production p : e.getValue()) {
                sb.append(sep).append(p.rhs());
                sep = " | ";
            }
            sb.append(LS);
        }
        return sb.toString();
    }
}
