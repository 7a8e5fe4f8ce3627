/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;
import static org.xtrms.automata.Misc.intersects;
import static org.xtrms.automata.Misc.setLabel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.AutomatonException.PreconditionException;
import org.xtrms.automata.AutomatonException.ResourceExhaustedException;
import org.xtrms.automata.Misc.BreadthFirstVisitor;
import org.xtrms.automata.Misc.SetQueue;

/**
 * A nondeterministic finite automaton with epsilon moves and string symbols.
 * Whether an instance is also a DFA is a property checked by {@link #isDfa()},
 * not a separate type.
 * <p>
 * Symbols may span several characters. Simulation consumes the input by
 * position, following whatever the automaton's {@link SymbolSelector} picks
 * at each position; with the default {@link MatchPolicy#LONGEST_MATCH} the
 * run is greedy and single path. {@link #toDfa()} and {@link #minimize()} work
 * on single characters only: a multi-character symbol is treated as its
 * individual characters, which changes the language of automata using such
 * symbols.
 * <p>
 * Instances are <em>not</em> thread safe.
 */
public final class FiniteAutomaton extends AbstractAcceptor {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * Default bound on the number of states created by subset construction.
     */
    static final int MAX_STATE_COUNT =
        Integer.getInteger("org.xtrms.automata.dfa.maxStates", 10 * 1000);

    static final String TRAP_STATE = "_error";

    /**
     * One edge of the automaton: a source, a label and one destination.
     */
    public static final class Transition {

        private final String source;
        private final Symbol symbol;
        private final String destination;

        Transition(String source, Symbol symbol, String destination) {
            this.source = source;
            this.symbol = symbol;
            this.destination = destination;
        }
        public String source() {
            return source;
        }
        public Symbol symbol() {
            return symbol;
        }
        public String destination() {
            return destination;
        }
        @Override
        public int hashCode() {
            final int prime = 31;
            int result = source.hashCode();
            result = prime * result + symbol.hashCode();
            result = prime * result + destination.hashCode();
            return result;
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Transition)) return false;
            final Transition t = (Transition) o;
            return source.equals(t.source) && symbol.equals(t.symbol)
                && destination.equals(t.destination);
        }
        @Override
        public String toString() {
            return source + " -" + symbol + "-> " + destination;
        }
    }

    /**
     * A history entry of {@link FiniteAutomaton#simulateHistory(String)}: the
     * epsilon closed set of active states at an input position.
     */
    public static final class Step {

        private final Set<String> states;
        private final int position;

        Step(Set<String> states, int position) {
            this.states = Collections.unmodifiableSet(new LinkedHashSet<String>(states));
            this.position = position;
        }
        public Set<String> states() {
            return states;
        }
        public int position() {
            return position;
        }
        @Override
        public String toString() {
            return position + ": " + setLabel(states);
        }
    }

    /*
     * state -> symbol -> destinations; no empty inner map or set is kept.
     */
    private final Map<String, Map<Symbol, Set<String>>> delta =
        new LinkedHashMap<String, Map<Symbol, Set<String>>>();

    private int maxDfaStates = MAX_STATE_COUNT;

    public FiniteAutomaton() {
    }

    /*
     * Transitions
     */

    /**
     * Adds {@code src --symbol--> dst}.
     *
     * @throws AutomatonException.UnknownStateException if either state is
     *         unknown; nothing is added
     */
    public void addTransition(String src, Symbol symbol, String dst) {
        requireState(src);
        requireState(dst);
        if (symbol == null) throw new IllegalArgumentException("symbol");
        Map<Symbol, Set<String>> out = delta.get(src);
        if (out == null) {
            delta.put(src, out = new LinkedHashMap<Symbol, Set<String>>());
        }
        Set<String> dsts = out.get(symbol);
        if (dsts == null) {
            out.put(symbol, dsts = new LinkedHashSet<String>());
        }
        dsts.add(dst);
    }

    public void addTransition(String src, String symbol, String dst) {
        addTransition(src, Symbol.of(symbol), dst);
    }

    /**
     * Removes one destination of a transition.
     *
     * @return true if the transition existed
     */
    public boolean removeTransition(String src, Symbol symbol, String dst) {
        Map<Symbol, Set<String>> out = delta.get(src);
        if (out == null) return false;
        Set<String> dsts = out.get(symbol);
        if (dsts == null || !dsts.remove(dst)) return false;
        if (dsts.isEmpty()) out.remove(symbol);
        if (out.isEmpty()) delta.remove(src);
        return true;
    }

    public Set<String> destinations(String state, Symbol symbol) {
        Map<Symbol, Set<String>> out = delta.get(state);
        Set<String> dsts = out == null ? null : out.get(symbol);
        return dsts == null
            ? Collections.<String>emptySet()
            : Collections.unmodifiableSet(dsts);
    }

    /**
     * @return every label, epsilon included, on a transition out of
     *         {@code state}
     */
    public Set<Symbol> symbolsFrom(String state) {
        Map<Symbol, Set<String>> out = delta.get(state);
        return out == null
            ? Collections.<Symbol>emptySet()
            : Collections.unmodifiableSet(out.keySet());
    }

    /**
     * @return the non-epsilon symbols in use, sorted
     */
    public SortedSet<Symbol> alphabet() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (Map<Symbol, Set<String>> out : delta.values()) {
            ret.addAll(out.keySet());
        }
        ret.remove(Symbol.EPSILON);
        return ret;
    }

    public List<Transition> transitions() {
        List<Transition> ret = new ArrayList<Transition>();
        for (Map.Entry<String, Map<Symbol, Set<String>>> e : delta.entrySet()) {
            for (Map.Entry<Symbol, Set<String>> f : e.getValue().entrySet()) {
                for (String dst : f.getValue()) {
                    ret.add(new Transition(e.getKey(), f.getKey(), dst));
                }
            }
        }
        return ret;
    }

    public int maxDfaStates() {
        return maxDfaStates;
    }

    public void setMaxDfaStates(int maxDfaStates) {
        if (maxDfaStates < 1) throw new IllegalArgumentException("maxDfaStates");
        this.maxDfaStates = maxDfaStates;
    }

    @Override
    void purgeTransitions(String state) {
        delta.remove(state);
        for (Iterator<Map<Symbol, Set<String>>> i = delta.values().iterator(); i.hasNext();) {
            Map<Symbol, Set<String>> out = i.next();
            for (Iterator<Set<String>> j = out.values().iterator(); j.hasNext();) {
                Set<String> dsts = j.next();
                dsts.remove(state);
                if (dsts.isEmpty()) j.remove();
            }
            if (out.isEmpty()) i.remove();
        }
    }

    @Override
    void renameTransitions(String from, String to) {
        Map<String, Map<Symbol, Set<String>>> renamed =
            new LinkedHashMap<String, Map<Symbol, Set<String>>>();
        for (Map.Entry<String, Map<Symbol, Set<String>>> e : delta.entrySet()) {
            for (Map.Entry<Symbol, Set<String>> f : e.getValue().entrySet()) {
                Set<String> dsts = new LinkedHashSet<String>();
                for (String dst : f.getValue()) {
                    dsts.add(dst.equals(from) ? to : dst);
                }
                f.setValue(dsts);
            }
            renamed.put(e.getKey().equals(from) ? to : e.getKey(), e.getValue());
        }
        delta.clear();
        delta.putAll(renamed);
    }

    /*
     * Closure, move, simulation
     */

    /**
     * @return {@code states} plus everything reachable from them through
     *         epsilon transitions
     */
    public Set<String> epsilonClosure(Collection<String> states) {
        Set<String> closure = new LinkedHashSet<String>(states);
        LinkedList<String> stack = new LinkedList<String>(states);
        while (!stack.isEmpty()) {
            for (String next : destinations(stack.removeFirst(), Symbol.EPSILON)) {
                if (closure.add(next)) {
                    stack.addFirst(next);
                }
            }
        }
        return closure;
    }

    /**
     * @return the union of the destinations of {@code symbol} out of
     *         {@code states}
     */
    public Set<String> move(Collection<String> states, Symbol symbol) {
        Set<String> ret = new LinkedHashSet<String>();
        for (String state : states) {
            ret.addAll(destinations(state, symbol));
        }
        return ret;
    }

    public boolean simulate(String input) {
        return simulateHistory(input).accepted();
    }

    /**
     * Runs the automaton over {@code input}. At each position the symbols out
     * of the active states are offered to the {@link #selector()}; the moves
     * under each chosen symbol are epsilon closed and continue at the
     * position after that symbol. The input is accepted if it is consumed
     * completely and an active set at its end contains a final state.
     *
     * @return the run; one history entry per input position reached
     */
    public Run<Step> simulateHistory(String input) {
        List<Step> history = new ArrayList<Step>();
        if (startState == null) {
            return new Run<Step>(history, false, 0, input.length());
        }
        TreeMap<Integer, Set<String>> frontier = new TreeMap<Integer, Set<String>>();
        frontier.put(0, epsilonClosure(Collections.singleton(startState)));
        boolean accepted = false;
        int consumed = 0;

        while (!frontier.isEmpty()) {
            Map.Entry<Integer, Set<String>> entry = frontier.pollFirstEntry();
            final int position = entry.getKey();
            final Set<String> active = entry.getValue();
            history.add(new Step(active, position));
            consumed = Math.max(consumed, position);
            if (position == input.length()) {
                accepted |= intersects(active, finalStates);
                continue;
            }
            Set<Symbol> candidates = new LinkedHashSet<Symbol>();
            for (String state : active) {
                candidates.addAll(symbolsFrom(state));
            }
            for (Symbol symbol : selector.select(candidates, input, position)) {
                Set<String> next = epsilonClosure(move(active, symbol));
                if (next.isEmpty()) continue;
                int to = position + symbol.length();
                Set<String> pending = frontier.get(to);
                if (pending == null) {
                    frontier.put(to, pending = new LinkedHashSet<String>());
                }
                pending.addAll(next);
            }
        }
        Run<Step> run = new Run<Step>(history, accepted, consumed, input.length());
        if (logger.isLoggable(level)) {
            logger.log(level, "simulate \"" + input + "\": " + run);
        }
        return run;
    }

    /*
     * Conversions
     */

    /**
     * @return true if there are no epsilon transitions, every symbol is a
     *         single character, and every (state, symbol) pair has exactly
     *         one destination
     */
    public boolean isDfa() {
        for (Map<Symbol, Set<String>> out : delta.values()) {
            for (Map.Entry<Symbol, Set<String>> e : out.entrySet()) {
                if (e.getKey().isEpsilon()) return false;
                if (!e.getKey().isSingleCharacter()) return false;
                if (e.getValue().size() != 1) return false;
            }
        }
        return true;
    }

    /**
     * Subset construction. The subset reached first is named {@code q0}, the
     * others {@code q1, q2, ...} in breadth first discovery order. The
     * alphabet is taken character by character: a multi-character symbol
     * contributes its characters, and is <em>not</em> followed as a unit.
     *
     * @return a new automaton satisfying {@link #isDfa()}, or null if there is
     *         no start state
     * @throws ResourceExhaustedException if more than {@link #maxDfaStates()}
     *         states would be created
     */
    public FiniteAutomaton toDfa() {
        if (startState == null) return null;

        final SortedSet<Symbol> sigma = new TreeSet<Symbol>();
        for (Symbol symbol : alphabet()) {
            sigma.addAll(symbol.characters());
        }
        final FiniteAutomaton dfa = new FiniteAutomaton();
        dfa.selector = selector;
        dfa.maxDfaStates = maxDfaStates;
        final Map<Set<String>, String> names = new LinkedHashMap<Set<String>, String>();

        final Set<String> init = epsilonClosure(Collections.singleton(startState));
        names.put(init, "q0");
        dfa.addState("q0", true, intersects(init, finalStates));

        /*
         * Subset construction as breadth first search
         */
        new BreadthFirstVisitor<Set<String>>() {
            @Override
            protected Iterable<Set<String>> visit(Set<String> subset) {
                List<Set<String>> successors = new ArrayList<Set<String>>();
                for (Symbol c : sigma) {
                    Set<String> u = epsilonClosure(move(subset, c));
                    if (u.isEmpty()) continue;
                    String name = names.get(u);
                    if (name == null) {
                        if (names.size() >= maxDfaStates) {
                            throw new ResourceExhaustedException(
                                "DFA state count exceeded: " + maxDfaStates);
                        }
                        name = "q" + names.size();
                        names.put(u, name);
                        dfa.addState(name, false, intersects(u, finalStates));
                    }
                    dfa.addTransition(names.get(subset), c, name);
                    successors.add(u);
                }
                return successors;
            }
        }.start(init);

        if (logger.isLoggable(level)) {
            logger.log(level, Misc.stringFrom("subsets", names) + "dfa: " + dfa);
        }
        return dfa;
    }

    /**
     * Minimizes a DFA by partition refinement. The receiver is not modified.
     * Missing transitions are first routed to a synthetic trap state, which is
     * gone again from the result. A state of the result is named after its
     * only member, or {@code {a,b,...}} (members sorted) for merged states.
     *
     * @throws PreconditionException if {@link #isDfa()} is false
     */
    public FiniteAutomaton minimize() {
        if (!isDfa()) {
            throw new PreconditionException("minimization requires a valid DFA");
        }
        FiniteAutomaton dfa = copy();
        SortedSet<Symbol> sigma = dfa.alphabet();
        String trap = dfa.complete(sigma);
        List<SortedSet<String>> partition = dfa.refine(sigma);

        if (trap != null) {
            List<SortedSet<String>> kept = new ArrayList<SortedSet<String>>(partition.size());
            for (SortedSet<String> block : partition) {
                SortedSet<String> b = new TreeSet<String>(block);
                b.remove(trap);
                if (!b.isEmpty()) kept.add(b);
            }
            partition = kept;
            dfa.removeState(trap);
        }
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "minimized partition: " + partition);
        }
        return dfa.quotient(partition);
    }

    /*
     * Makes the transition function total over sigma.
     *
     * @return the name of the trap state added, or null if already total
     */
    private String complete(Set<Symbol> sigma) {
        boolean total = true;
        for (String state : states) {
            for (Symbol c : sigma) {
                if (destinations(state, c).isEmpty()) total = false;
            }
        }
        if (total) return null;

        String trap = TRAP_STATE;
        for (int i = 1; states.contains(trap); ++i) {
            trap = TRAP_STATE + i;
        }
        states.add(trap);
        for (String state : new ArrayList<String>(states)) {
            for (Symbol c : sigma) {
                if (destinations(state, c).isEmpty()) {
                    addTransition(state, c, trap);
                }
            }
        }
        return trap;
    }

    /*
     * Hopcroft refinement of {final, non-final} on a total DFA.
     */
    private List<SortedSet<String>> refine(Set<Symbol> sigma) {

        // symbol -> target -> sources
        final Map<Symbol, Map<String, Set<String>>> inverse =
            new HashMap<Symbol, Map<String, Set<String>>>();
        for (Transition t : transitions()) {
            Map<String, Set<String>> bySymbol = inverse.get(t.symbol());
            if (bySymbol == null) {
                inverse.put(t.symbol(), bySymbol = new HashMap<String, Set<String>>());
            }
            Set<String> sources = bySymbol.get(t.destination());
            if (sources == null) {
                bySymbol.put(t.destination(), sources = new HashSet<String>());
            }
            sources.add(t.source());
        }

        SortedSet<String> accepting = new TreeSet<String>(finalStates);
        SortedSet<String> rejecting = new TreeSet<String>(states);
        rejecting.removeAll(finalStates);

        List<SortedSet<String>> partition = new ArrayList<SortedSet<String>>();
        SetQueue<SortedSet<String>> worklist = new SetQueue<SortedSet<String>>();
        if (!accepting.isEmpty()) partition.add(accepting);
        if (!rejecting.isEmpty()) partition.add(rejecting);
        if (partition.size() == 2) {
            worklist.offer(accepting.size() <= rejecting.size() ? accepting : rejecting);
        }

        while (!worklist.isEmpty()) {
            SortedSet<String> splitter = worklist.poll();
            for (Symbol c : sigma) {
                Map<String, Set<String>> bySymbol = inverse.get(c);
                if (bySymbol == null) continue;
                Set<String> x = new HashSet<String>();
                for (String q : splitter) {
                    Set<String> sources = bySymbol.get(q);
                    if (sources != null) x.addAll(sources);
                }
                if (x.isEmpty()) continue;

                List<SortedSet<String>> refined =
                    new ArrayList<SortedSet<String>>(partition.size() + 1);
                for (SortedSet<String> y : partition) {
                    SortedSet<String> inter = new TreeSet<String>();
                    SortedSet<String> diff = new TreeSet<String>();
                    for (String q : y) {
                        (x.contains(q) ? inter : diff).add(q);
                    }
                    if (inter.isEmpty() || diff.isEmpty()) {
                        refined.add(y);
                        continue;
                    }
                    refined.add(inter);
                    refined.add(diff);
                    if (worklist.remove(y)) {
                        worklist.offer(inter);
                        worklist.offer(diff);
                    } else {
                        worklist.offer(inter.size() <= diff.size() ? inter : diff);
                    }
                }
                partition = refined;
            }
        }
        return partition;
    }

    private FiniteAutomaton quotient(List<SortedSet<String>> partition) {
        FiniteAutomaton min = new FiniteAutomaton();
        min.selector = selector;
        min.maxDfaStates = maxDfaStates;
        Map<String, String> blockOf = new HashMap<String, String>();
        for (SortedSet<String> block : partition) {
            String name = block.size() == 1 ? block.first() : setLabel(block);
            for (String q : block) {
                blockOf.put(q, name);
            }
            min.addState(name,
                startState != null && block.contains(startState),
                intersects(block, finalStates));
        }
        if (startState == null) {
            min.clearStartState();
        }
        for (SortedSet<String> block : partition) {
            String from = blockOf.get(block.first());
            for (String q : block) {
                Map<Symbol, Set<String>> out = delta.get(q);
                if (out == null) continue;
                for (Map.Entry<Symbol, Set<String>> e : out.entrySet()) {
                    String to = blockOf.get(e.getValue().iterator().next());
                    if (to != null && min.destinations(from, e.getKey()).isEmpty()) {
                        min.addTransition(from, e.getKey(), to);
                    }
                }
            }
        }
        return min;
    }

    /**
     * Derives a right-linear grammar whose nonterminals are the states and
     * whose start symbol is the start state.
     *
     * @param strict if true, multi-character terminals are split into chains
     *        of fresh nonterminals so that every production carries at most
     *        one single-character terminal
     * @throws PreconditionException if there is no start state
     */
    public RegularGrammar toRegularGrammar(boolean strict) {
        if (startState == null) {
            throw new PreconditionException("grammar extraction requires a start state");
        }
        RegularGrammar grammar = new RegularGrammar(startState, states);
        for (String p : states) {
            Set<String> reach = epsilonClosure(Collections.singleton(p));
            if (intersects(reach, finalStates)) {
                grammar.add(p, Symbol.EPSILON, null);
            }
            for (String r : reach) {
                Map<Symbol, Set<String>> out = delta.get(r);
                if (out == null) continue;
                for (Map.Entry<Symbol, Set<String>> e : out.entrySet()) {
                    if (e.getKey().isEpsilon()) continue;
                    for (String dst : e.getValue()) {
                        grammar.addRule(p, e.getKey(), dst, finalStates.contains(dst), strict);
                    }
                }
            }
        }
        return grammar;
    }

    /*
     * Persistence
     */

    public String toJson() {
        return AutomatonJson.write(this);
    }

    /**
     * Reads an automaton written by {@link #toJson()}. Malformed transitions
     * are skipped with a warning.
     *
     * @throws AutomatonException.MalformedDataException if {@code json} is
     *         not a JSON object
     */
    public static FiniteAutomaton fromJson(String json) {
        return AutomatonJson.readFiniteAutomaton(json);
    }

    public FiniteAutomaton copy() {
        FiniteAutomaton copy = new FiniteAutomaton();
        copyAcceptorTo(copy);
        copy.maxDfaStates = maxDfaStates;
        for (Transition t : transitions()) {
            copy.addTransition(t.source(), t.symbol(), t.destination());
        }
        return copy;
    }

    @Override
    public int hashCode() {
        return 31 * acceptorHashCode() + delta.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FiniteAutomaton)) return false;
        final FiniteAutomaton other = (FiniteAutomaton) o;
        return acceptorEqual(other) && delta.equals(other.delta);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        List<Transition> transitions = transitions();
        sb
            .append("total states: ").append(states.size())
            .append(" total transitions: ").append(transitions.size())
            .append(LS);
        for (String state : states) {
            sb.append("state: ").append(state).append(' ');
            if (state.equals(startState)) sb.append("(start) ");
            if (finalStates.contains(state)) sb.append("(final) ");
            sb.append(LS);
        }
        for (Transition t : transitions) {
            sb.append("    ").append(t).append(LS);
        }
        return sb.toString();
    }
}
