/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A Mealy machine: the output is written by the transitions taken.
 */
public final class MealyMachine extends AbstractTransducer {

    /**
     * A transition as listed by {@link MealyMachine#transitions()}.
     */
    public static final class Transition {

        private final String source;
        private final Symbol input;
        private final String destination;
        private final String output;

        Transition(String source, Symbol input, String destination, String output) {
            this.source = source;
            this.input = input;
            this.destination = destination;
            this.output = output;
        }
        public String source() {
            return source;
        }
        public Symbol input() {
            return input;
        }
        public String destination() {
            return destination;
        }
        public String output() {
            return output;
        }
        @Override
        public String toString() {
            return source + " -" + input + "/" + output + "-> " + destination;
        }
    }

    /*
     * (dst, output)
     */
    private static final class Edge {

        final String dst;
        final String output;

        Edge(String dst, String output) {
            this.dst = dst;
            this.output = output;
        }
        @Override
        public int hashCode() {
            return 31 * dst.hashCode() + output.hashCode();
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Edge)) return false;
            final Edge e = (Edge) o;
            return dst.equals(e.dst) && output.equals(e.output);
        }
    }

    private final Map<String, Map<Symbol, Edge>> delta =
        new LinkedHashMap<String, Map<Symbol, Edge>>();

    public MealyMachine() {
    }

    public void addState(String state) {
        doAddState(state);
    }

    public void addState(String state, boolean start) {
        doAddState(state);
        if (start) {
            startState = state;
        }
    }

    /**
     * Adds {@code src --input/output--> dst}, replacing any transition from
     * {@code src} on {@code input}.
     */
    public void addTransition(String src, Symbol input, String dst, String output) {
        requireState(src);
        requireState(dst);
        checkInput(input);
        checkOutput(output);
        Map<Symbol, Edge> out = delta.get(src);
        if (out == null) {
            delta.put(src, out = new LinkedHashMap<Symbol, Edge>());
        }
        out.put(input, new Edge(dst, output));
    }

    public void addTransition(String src, String input, String dst, String output) {
        addTransition(src, Symbol.of(input), dst, output);
    }

    /**
     * @return true if there was such a transition
     */
    public boolean removeTransition(String src, Symbol input) {
        Map<Symbol, Edge> out = delta.get(src);
        if (out == null || out.remove(input) == null) return false;
        if (out.isEmpty()) delta.remove(src);
        return true;
    }

    private Edge edge(String src, Symbol input) {
        Map<Symbol, Edge> out = delta.get(src);
        return out == null ? null : out.get(input);
    }

    @Override
    public String target(String src, Symbol input) {
        Edge e = edge(src, input);
        return e == null ? null : e.dst;
    }

    /**
     * @return the output written by {@code src --input-->}, or null if there
     *         is no such transition
     */
    public String outputOf(String src, Symbol input) {
        Edge e = edge(src, input);
        return e == null ? null : e.output;
    }

    public String outputOf(String src, String input) {
        return outputOf(src, Symbol.of(input));
    }

    @Override
    Set<Symbol> inputsFrom(String state) {
        Map<Symbol, Edge> out = delta.get(state);
        return out == null ? Collections.<Symbol>emptySet() : out.keySet();
    }

    @Override
    String emit(String src, Symbol input) {
        return outputOf(src, input);
    }

    @Override
    String initialOutput(String start) {
        return "";
    }

    @Override
    public SortedSet<Symbol> inputAlphabet() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (Map<Symbol, Edge> out : delta.values()) {
            ret.addAll(out.keySet());
        }
        return ret;
    }

    /**
     * @return the non-empty transition outputs, sorted
     */
    @Override
    public SortedSet<String> outputAlphabet() {
        List<String> values = new ArrayList<String>();
        for (Transition t : transitions()) {
            values.add(t.output());
        }
        return outputs(values);
    }

    public List<Transition> transitions() {
        List<Transition> ret = new ArrayList<Transition>();
        for (Map.Entry<String, Map<Symbol, Edge>> e : delta.entrySet()) {
            for (Map.Entry<Symbol, Edge> f : e.getValue().entrySet()) {
                ret.add(new Transition(e.getKey(), f.getKey(), f.getValue().dst, f.getValue().output));
            }
        }
        return ret;
    }

    @Override
    void purge(String state) {
        delta.remove(state);
        for (Iterator<Map<Symbol, Edge>> i = delta.values().iterator(); i.hasNext();) {
            Map<Symbol, Edge> out = i.next();
            for (Iterator<Edge> j = out.values().iterator(); j.hasNext();) {
                if (j.next().dst.equals(state)) j.remove();
            }
            if (out.isEmpty()) i.remove();
        }
    }

    @Override
    void rename(String from, String to) {
        Map<String, Map<Symbol, Edge>> renamed = new LinkedHashMap<String, Map<Symbol, Edge>>();
        for (Map.Entry<String, Map<Symbol, Edge>> e : delta.entrySet()) {
            for (Map.Entry<Symbol, Edge> f : e.getValue().entrySet()) {
                if (f.getValue().dst.equals(from)) {
                    f.setValue(new Edge(to, f.getValue().output));
                }
            }
            renamed.put(e.getKey().equals(from) ? to : e.getKey(), e.getValue());
        }
        delta.clear();
        delta.putAll(renamed);
    }

    public String toJson() {
        return AutomatonJson.write(this);
    }

    /**
     * Reads a machine written by {@link #toJson()}. Malformed transitions are
     * skipped with a warning.
     *
     * @throws AutomatonException.MalformedDataException if {@code json} is
     *         not a JSON object
     */
    public static MealyMachine fromJson(String json) {
        return AutomatonJson.readMealyMachine(json);
    }

    public MealyMachine copy() {
        MealyMachine copy = new MealyMachine();
        copyStatesTo(copy);
        for (Map.Entry<String, Map<Symbol, Edge>> e : delta.entrySet()) {
            copy.delta.put(e.getKey(), new LinkedHashMap<Symbol, Edge>(e.getValue()));
        }
        return copy;
    }

    @Override
    public int hashCode() {
        return 31 * statesHashCode() + delta.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MealyMachine)) return false;
        final MealyMachine other = (MealyMachine) o;
        return statesEqual(other) && delta.equals(other.delta);
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
            sb.append(LS);
        }
        for (Transition t : transitions) {
            sb.append("    ").append(t).append(LS);
        }
        return sb.toString();
    }
}
