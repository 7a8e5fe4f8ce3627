/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
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

import org.xtrms.automata.AutomatonException.ResourceExhaustedException;
import org.xtrms.automata.Misc.SetQueue;

/**
 * A nondeterministic pushdown automaton accepting by final state.
 * <p>
 * A transition is keyed by (state, input, pop) where input and pop may each be
 * {@link Symbol#EPSILON}, and leads to any number of (state, push) targets. A
 * non-epsilon pop matches the top of stack exactly. A push of {@code "AB"}
 * pushes {@code A} then {@code B}, leaving {@code B} on top; an epsilon push
 * pushes nothing. The stack starts out holding the
 * {@linkplain #startStackSymbol() start stack symbol}.
 * <p>
 * The search over configurations is bounded both in the number of
 * configurations visited and in stack depth, so a machine which grows its
 * stack on epsilon moves fails with a {@link ResourceExhaustedException}
 * instead of running forever.
 * <p>
 * As for every automaton in this package, the first state added becomes the
 * start state; a PDA does not wait for an explicit
 * {@link #setStartState(String)} before it can run.
 */
public final class PushdownAutomaton extends AbstractAcceptor {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINER;

    static final int MAX_CONFIGURATIONS =
        Integer.getInteger("org.xtrms.automata.pda.maxConfigurations", 100 * 1000);
    static final int MAX_STACK_DEPTH =
        Integer.getInteger("org.xtrms.automata.pda.maxStackDepth", 10 * 1000);

    public static final String DEFAULT_START_STACK_SYMBOL = "Z";

    /*
     * (state, input, pop)
     */
    private static final class Key {

        final String state;
        final Symbol input;
        final Symbol pop;

        Key(String state, Symbol input, Symbol pop) {
            this.state = state;
            this.input = input;
            this.pop = pop;
        }
        @Override
        public int hashCode() {
            return (31 * state.hashCode() + input.hashCode()) * 31 + pop.hashCode();
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            final Key k = (Key) o;
            return state.equals(k.state) && input.equals(k.input) && pop.equals(k.pop);
        }
    }

    /**
     * Where a transition leads: the next state and what it pushes.
     */
    public static final class Target {

        private final String state;
        private final Symbol push;

        Target(String state, Symbol push) {
            this.state = state;
            this.push = push;
        }
        public String state() {
            return state;
        }
        public Symbol push() {
            return push;
        }
        @Override
        public int hashCode() {
            return 31 * state.hashCode() + push.hashCode();
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Target)) return false;
            final Target t = (Target) o;
            return state.equals(t.state) && push.equals(t.push);
        }
        @Override
        public String toString() {
            return "(" + state + ", " + push + ")";
        }
    }

    /**
     * A fully spelled out transition, as listed by
     * {@link PushdownAutomaton#transitions()}.
     */
    public static final class Transition {

        private final String source;
        private final Symbol input;
        private final Symbol pop;
        private final Target target;

        Transition(String source, Symbol input, Symbol pop, Target target) {
            this.source = source;
            this.input = input;
            this.pop = pop;
            this.target = target;
        }
        public String source() {
            return source;
        }
        public Symbol input() {
            return input;
        }
        public Symbol pop() {
            return pop;
        }
        public String destination() {
            return target.state();
        }
        public Symbol push() {
            return target.push();
        }
        @Override
        public String toString() {
            return source + " -" + input + "," + pop + "/" + push() + "-> " + destination();
        }
    }

    /**
     * An instantaneous description: current state, input position and stack.
     * The last stack element is the top.
     */
    public static final class Configuration {

        private final String state;
        private final int position;
        private final List<String> stack;

        Configuration(String state, int position, List<String> stack) {
            this.state = state;
            this.position = position;
            this.stack = Collections.unmodifiableList(stack);
        }
        public String state() {
            return state;
        }
        public int position() {
            return position;
        }
        public List<String> stack() {
            return stack;
        }
        /**
         * @return the top of stack, or null if the stack is empty
         */
        public String top() {
            return stack.isEmpty() ? null : stack.get(stack.size() - 1);
        }
        @Override
        public int hashCode() {
            return (31 * state.hashCode() + position) * 31 + stack.hashCode();
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Configuration)) return false;
            final Configuration c = (Configuration) o;
            return position == c.position && state.equals(c.state) && stack.equals(c.stack);
        }
        @Override
        public String toString() {
            return "(" + state + ", " + position + ", " + stack + ")";
        }
    }

    private final Map<Key, Set<Target>> delta = new LinkedHashMap<Key, Set<Target>>();
    private String startStackSymbol = DEFAULT_START_STACK_SYMBOL;
    private int maxConfigurations = MAX_CONFIGURATIONS;
    private int maxStackDepth = MAX_STACK_DEPTH;

    public PushdownAutomaton() {
    }

    public String startStackSymbol() {
        return startStackSymbol;
    }

    public void setStartStackSymbol(String symbol) {
        if (symbol == null || symbol.length() == 0) {
            throw new IllegalArgumentException("start stack symbol must be non-empty");
        }
        if (Symbol.isEpsilonMarker(symbol)) {
            throw new IllegalArgumentException("reserved start stack symbol: " + symbol);
        }
        startStackSymbol = symbol;
    }

    public int maxConfigurations() {
        return maxConfigurations;
    }

    public void setMaxConfigurations(int maxConfigurations) {
        if (maxConfigurations < 1) throw new IllegalArgumentException("maxConfigurations");
        this.maxConfigurations = maxConfigurations;
    }

    public int maxStackDepth() {
        return maxStackDepth;
    }

    public void setMaxStackDepth(int maxStackDepth) {
        if (maxStackDepth < 1) throw new IllegalArgumentException("maxStackDepth");
        this.maxStackDepth = maxStackDepth;
    }

    /*
     * Transitions
     */

    /**
     * Adds {@code src --input, pop / push--> dst}.
     *
     * @throws AutomatonException.UnknownStateException if either state is
     *         unknown; nothing is added
     */
    public void addTransition(String src, Symbol input, Symbol pop, String dst, Symbol push) {
        requireState(src);
        requireState(dst);
        if (input == null || pop == null || push == null) {
            throw new IllegalArgumentException("symbols must be non-null");
        }
        Key key = new Key(src, input, pop);
        Set<Target> targets = delta.get(key);
        if (targets == null) {
            delta.put(key, targets = new LinkedHashSet<Target>());
        }
        targets.add(new Target(dst, push));
    }

    /**
     * @return true if the transition existed
     */
    public boolean removeTransition(String src, Symbol input, Symbol pop, String dst, Symbol push) {
        Key key = new Key(src, input, pop);
        Set<Target> targets = delta.get(key);
        if (targets == null || !targets.remove(new Target(dst, push))) return false;
        if (targets.isEmpty()) delta.remove(key);
        return true;
    }

    public Set<Target> targets(String src, Symbol input, Symbol pop) {
        Set<Target> targets = delta.get(new Key(src, input, pop));
        return targets == null
            ? Collections.<Target>emptySet()
            : Collections.unmodifiableSet(targets);
    }

    public List<Transition> transitions() {
        List<Transition> ret = new ArrayList<Transition>();
        for (Map.Entry<Key, Set<Target>> e : delta.entrySet()) {
            Key k = e.getKey();
            for (Target t : e.getValue()) {
                ret.add(new Transition(k.state, k.input, k.pop, t));
            }
        }
        return ret;
    }

    public SortedSet<Symbol> inputAlphabet() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (Key k : delta.keySet()) {
            if (!k.input.isEpsilon()) ret.add(k.input);
        }
        return ret;
    }

    /**
     * @return the start stack symbol, every pop symbol and every pushed
     *         character
     */
    public SortedSet<String> stackAlphabet() {
        SortedSet<String> ret = new TreeSet<String>();
        ret.add(startStackSymbol);
        for (Map.Entry<Key, Set<Target>> e : delta.entrySet()) {
            if (!e.getKey().pop.isEpsilon()) ret.add(e.getKey().pop.text());
            for (Target t : e.getValue()) {
                for (Symbol c : t.push.characters()) {
                    ret.add(c.text());
                }
            }
        }
        return ret;
    }

    private Set<Symbol> inputsFrom(String state) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (Key k : delta.keySet()) {
            if (k.state.equals(state) && !k.input.isEpsilon()) ret.add(k.input);
        }
        return ret;
    }

    @Override
    void purgeTransitions(String state) {
        for (Iterator<Map.Entry<Key, Set<Target>>> i = delta.entrySet().iterator(); i.hasNext();) {
            Map.Entry<Key, Set<Target>> e = i.next();
            if (e.getKey().state.equals(state)) {
                i.remove();
                continue;
            }
            for (Iterator<Target> j = e.getValue().iterator(); j.hasNext();) {
                if (j.next().state.equals(state)) j.remove();
            }
            if (e.getValue().isEmpty()) i.remove();
        }
    }

    @Override
    void renameTransitions(String from, String to) {
        Map<Key, Set<Target>> renamed = new LinkedHashMap<Key, Set<Target>>();
        for (Map.Entry<Key, Set<Target>> e : delta.entrySet()) {
            Key k = e.getKey();
            Set<Target> targets = new LinkedHashSet<Target>();
            for (Target t : e.getValue()) {
                targets.add(t.state.equals(from) ? new Target(to, t.push) : t);
            }
            renamed.put(k.state.equals(from) ? new Key(to, k.input, k.pop) : k, targets);
        }
        delta.clear();
        delta.putAll(renamed);
    }

    /*
     * Configurations
     */

    /**
     * @return (start, 0, [start stack symbol]), or null without a start state
     */
    public Configuration initialConfiguration() {
        if (startState == null) return null;
        return new Configuration(startState, 0, Collections.singletonList(startStackSymbol));
    }

    /*
     * Every configuration reachable from c in one step consuming input, which
     * may be epsilon.
     */
    private List<Configuration> successors(Configuration c, Symbol input) {
        List<Configuration> ret = new ArrayList<Configuration>();
        int position = c.position + input.length();
        for (Target t : targets(c.state, input, Symbol.EPSILON)) {
            ret.add(apply(c, false, t, position));
        }
        String top = c.top();
        if (top != null) {
            for (Target t : targets(c.state, input, Symbol.of(top))) {
                ret.add(apply(c, true, t, position));
            }
        }
        return ret;
    }

    private Configuration apply(Configuration c, boolean pop, Target t, int position) {
        List<String> stack = new ArrayList<String>(c.stack);
        if (pop) {
            stack.remove(stack.size() - 1);
        }
        for (Symbol ch : t.push.characters()) {
            stack.add(ch.text());
        }
        if (stack.size() > maxStackDepth) {
            throw new ResourceExhaustedException("stack depth exceeded: " + maxStackDepth);
        }
        return new Configuration(t.state, position, stack);
    }

    /**
     * @return {@code configs} plus every configuration reachable from them by
     *         transitions reading no input
     * @throws ResourceExhaustedException if the closure grows beyond
     *         {@link #maxConfigurations()}
     */
    public Set<Configuration> epsilonClosure(Collection<Configuration> configs) {
        Set<Configuration> closure = new LinkedHashSet<Configuration>(configs);
        LinkedList<Configuration> work = new LinkedList<Configuration>(configs);
        while (!work.isEmpty()) {
            for (Configuration next : successors(work.removeFirst(), Symbol.EPSILON)) {
                if (closure.add(next)) {
                    if (closure.size() > maxConfigurations) {
                        throw new ResourceExhaustedException(
                            "configuration count exceeded: " + maxConfigurations);
                    }
                    work.add(next);
                }
            }
        }
        return closure;
    }

    /**
     * @return the configurations reached from {@code configs} by consuming
     *         {@code input}, with and without popping
     */
    public Set<Configuration> move(Collection<Configuration> configs, Symbol input) {
        if (input.isEpsilon()) throw new IllegalArgumentException("move needs an input symbol");
        Set<Configuration> ret = new LinkedHashSet<Configuration>();
        for (Configuration c : configs) {
            ret.addAll(successors(c, input));
        }
        return ret;
    }

    public boolean simulate(String input) {
        return simulateHistory(input).accepted();
    }

    /**
     * Breadth first search over configurations. Input symbols are chosen per
     * configuration by the {@link #selector()}; epsilon moves are always
     * followed. The input is accepted if some configuration at its end is in a
     * final state.
     *
     * @return the run; its history holds the first configuration reached at
     *         each input position, in position order
     * @throws ResourceExhaustedException if the search visits more than
     *         {@link #maxConfigurations()} configurations, or a stack grows
     *         beyond {@link #maxStackDepth()}
     */
    public Run<Configuration> simulateHistory(String input) {
        final int n = input.length();
        if (startState == null) {
            return new Run<Configuration>(Collections.<Configuration>emptyList(), false, 0, n);
        }
        TreeMap<Integer, Configuration> firstAt = new TreeMap<Integer, Configuration>();
        Set<Configuration> visited = new HashSet<Configuration>();
        SetQueue<Configuration> queue = new SetQueue<Configuration>(
            epsilonClosure(Collections.singleton(initialConfiguration())));
        boolean accepted = false;

        while (!queue.isEmpty()) {
            Configuration c = queue.poll();
            if (!visited.add(c)) continue;
            if (visited.size() > maxConfigurations) {
                throw new ResourceExhaustedException(
                    "configuration count exceeded: " + maxConfigurations);
            }
            if (!firstAt.containsKey(c.position)) {
                firstAt.put(c.position, c);
            }
            if (c.position == n) {
                accepted |= finalStates.contains(c.state);
            } else {
                for (Symbol symbol : selector.select(inputsFrom(c.state), input, c.position)) {
                    for (Configuration next : epsilonClosure(successors(c, symbol))) {
                        if (!visited.contains(next)) queue.offer(next);
                    }
                }
            }
            for (Configuration next : successors(c, Symbol.EPSILON)) {
                if (!visited.contains(next)) queue.offer(next);
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "pda search \"" + input + "\": " + visited.size()
                + " configurations, accepted: " + accepted);
        }
        return new Run<Configuration>(
            new ArrayList<Configuration>(firstAt.values()), accepted, firstAt.lastKey(), n);
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
    public static PushdownAutomaton fromJson(String json) {
        return AutomatonJson.readPushdownAutomaton(json);
    }

    public PushdownAutomaton copy() {
        PushdownAutomaton copy = new PushdownAutomaton();
        copyAcceptorTo(copy);
        copy.startStackSymbol = startStackSymbol;
        copy.maxConfigurations = maxConfigurations;
        copy.maxStackDepth = maxStackDepth;
        for (Map.Entry<Key, Set<Target>> e : delta.entrySet()) {
            copy.delta.put(e.getKey(), new LinkedHashSet<Target>(e.getValue()));
        }
        return copy;
    }

    @Override
    public int hashCode() {
        return (31 * acceptorHashCode() + startStackSymbol.hashCode()) * 31 + delta.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PushdownAutomaton)) return false;
        final PushdownAutomaton other = (PushdownAutomaton) o;
        return acceptorEqual(other)
            && startStackSymbol.equals(other.startStackSymbol)
            && delta.equals(other.delta);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        List<Transition> transitions = transitions();
        sb
            .append("total states: ").append(states.size())
            .append(" total transitions: ").append(transitions.size())
            .append(" start stack symbol: ").append(startStackSymbol)
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
