/*
 * @LICENSE@
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A Moore machine: every state carries an output string, written whenever the
 * state is entered, and once for the start state before any input is read.
 */
public final class MooreMachine extends AbstractTransducer {

    private final Map<String, String> outputs = new LinkedHashMap<String, String>();
    private final Map<String, Map<Symbol, String>> delta =
        new LinkedHashMap<String, Map<Symbol, String>>();

    public MooreMachine() {
    }

    public void addState(String state, String output) {
        addState(state, output, false);
    }

    /**
     * Adds a state, or updates the output of an existing one.
     */
    public void addState(String state, String output, boolean start) {
        checkName(state);
        checkOutput(output);
        doAddState(state);
        if (start) {
            startState = state;
        }
        outputs.put(state, output);
    }

    public String output(String state) {
        requireState(state);
        return outputs.get(state);
    }

    public void setOutput(String state, String output) {
        requireState(state);
        checkOutput(output);
        outputs.put(state, output);
    }

    /**
     * Adds {@code src --input--> dst}, replacing any transition from
     * {@code src} on {@code input}.
     */
    public void addTransition(String src, Symbol input, String dst) {
        requireState(src);
        requireState(dst);
        checkInput(input);
        Map<Symbol, String> out = delta.get(src);
        if (out == null) {
            delta.put(src, out = new LinkedHashMap<Symbol, String>());
        }
        out.put(input, dst);
    }

    public void addTransition(String src, String input, String dst) {
        addTransition(src, Symbol.of(input), dst);
    }

    /**
     * @return true if there was such a transition
     */
    public boolean removeTransition(String src, Symbol input) {
        Map<Symbol, String> out = delta.get(src);
        if (out == null || out.remove(input) == null) return false;
        if (out.isEmpty()) delta.remove(src);
        return true;
    }

    @Override
    public String target(String src, Symbol input) {
        Map<Symbol, String> out = delta.get(src);
        return out == null ? null : out.get(input);
    }

    @Override
    Set<Symbol> inputsFrom(String state) {
        Map<Symbol, String> out = delta.get(state);
        return out == null ? Collections.<Symbol>emptySet() : out.keySet();
    }

    @Override
    String emit(String src, Symbol input) {
        return outputs.get(target(src, input));
    }

    @Override
    String initialOutput(String start) {
        return outputs.get(start);
    }

    @Override
    public SortedSet<Symbol> inputAlphabet() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (Map<Symbol, String> out : delta.values()) {
            ret.addAll(out.keySet());
        }
        return ret;
    }

    /**
     * @return the non-empty state outputs, sorted
     */
    @Override
    public SortedSet<String> outputAlphabet() {
        return outputs(outputs.values());
    }

    /**
     * @return src -> input -> dst, in insertion order
     */
    public Map<String, Map<Symbol, String>> transitions() {
        Map<String, Map<Symbol, String>> ret = new LinkedHashMap<String, Map<Symbol, String>>();
        for (Map.Entry<String, Map<Symbol, String>> e : delta.entrySet()) {
            ret.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(ret);
    }

    @Override
    void purge(String state) {
        outputs.remove(state);
        delta.remove(state);
        for (Iterator<Map<Symbol, String>> i = delta.values().iterator(); i.hasNext();) {
            Map<Symbol, String> out = i.next();
            out.values().removeAll(Collections.singleton(state));
            if (out.isEmpty()) i.remove();
        }
    }

    @Override
    void rename(String from, String to) {
        Map<String, String> renamedOutputs = new LinkedHashMap<String, String>();
        for (Map.Entry<String, String> e : outputs.entrySet()) {
            renamedOutputs.put(e.getKey().equals(from) ? to : e.getKey(), e.getValue());
        }
        outputs.clear();
        outputs.putAll(renamedOutputs);

        Map<String, Map<Symbol, String>> renamed = new LinkedHashMap<String, Map<Symbol, String>>();
        for (Map.Entry<String, Map<Symbol, String>> e : delta.entrySet()) {
            for (Map.Entry<Symbol, String> f : e.getValue().entrySet()) {
                if (f.getValue().equals(from)) f.setValue(to);
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
    public static MooreMachine fromJson(String json) {
        return AutomatonJson.readMooreMachine(json);
    }

    public MooreMachine copy() {
        MooreMachine copy = new MooreMachine();
        copyStatesTo(copy);
        copy.outputs.putAll(outputs);
        for (Map.Entry<String, Map<Symbol, String>> e : delta.entrySet()) {
            copy.delta.put(e.getKey(), new LinkedHashMap<Symbol, String>(e.getValue()));
        }
        return copy;
    }

    @Override
    public int hashCode() {
        return (31 * statesHashCode() + outputs.hashCode()) * 31 + delta.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MooreMachine)) return false;
        final MooreMachine other = (MooreMachine) o;
        return statesEqual(other) && outputs.equals(other.outputs) && delta.equals(other.delta);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(states.size()).append(LS);
        for (String state : states) {
            sb.append("state: ").append(state).append(" / \"").append(outputs.get(state))
                .append("\" ");
            if (state.equals(startState)) sb.append("(start) ");
            sb.append(LS);
            Map<Symbol, String> out = delta.get(state);
            if (out == null) continue;
            for (Map.Entry<Symbol, String> e : out.entrySet()) {
                sb.append("    -").append(e.getKey()).append("-> ").append(e.getValue()).append(LS);
            }
        }
        return sb.toString();
    }
}
