/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.AutomatonException.MalformedDataException;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON persistence for every automaton kind. Documents are written from the
 * DTOs below and read back leniently through the tree model: a bad transition
 * entry is logged and skipped rather than failing the whole load.
 * <p>
 * Epsilon is written as {@code "&"}; {@code "ε"} is accepted as well on read.
 * Alphabets are written for the reader's benefit only and are recomputed from
 * the transitions on load.
 */
final class AutomatonJson {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.WARNING;

    static final String EPSILON = Symbol.EPSILON_MARKER;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private AutomatonJson() {
    } // never instantiated

    /*
     * Documents
     */

    @JsonPropertyOrder({ "states", "start_state", "final_states", "alphabet", "transitions" })
    static final class FiniteAutomatonDocument {
        @JsonProperty("states") List<String> states;
        @JsonProperty("start_state") String startState;
        @JsonProperty("final_states") List<String> finalStates;
        @JsonProperty("alphabet") List<String> alphabet;
        @JsonProperty("transitions") List<FiniteAutomatonTransition> transitions;
    }

    @JsonPropertyOrder({ "src", "symbol", "dsts" })
    static final class FiniteAutomatonTransition {
        @JsonProperty("src") String src;
        @JsonProperty("symbol") String symbol;
        @JsonProperty("dsts") List<String> dsts;
    }

    @JsonPropertyOrder({ "states", "input_alphabet", "stack_alphabet", "start_state",
        "start_stack_symbol", "final_states", "transitions" })
    static final class PushdownDocument {
        @JsonProperty("states") List<String> states;
        @JsonProperty("input_alphabet") List<String> inputAlphabet;
        @JsonProperty("stack_alphabet") List<String> stackAlphabet;
        @JsonProperty("start_state") String startState;
        @JsonProperty("start_stack_symbol") String startStackSymbol;
        @JsonProperty("final_states") List<String> finalStates;
        @JsonProperty("transitions") Map<String, List<List<String>>> transitions;
    }

    @JsonPropertyOrder({ "states", "start_state", "input_alphabet", "output_alphabet",
        "output_function", "transitions" })
    static final class MooreDocument {
        @JsonProperty("states") List<String> states;
        @JsonProperty("start_state") String startState;
        @JsonProperty("input_alphabet") List<String> inputAlphabet;
        @JsonProperty("output_alphabet") List<String> outputAlphabet;
        @JsonProperty("output_function") Map<String, String> outputFunction;
        @JsonProperty("transitions") List<MooreTransition> transitions;
    }

    @JsonPropertyOrder({ "src", "input", "dst" })
    static final class MooreTransition {
        @JsonProperty("src") String src;
        @JsonProperty("input") String input;
        @JsonProperty("dst") String dst;
    }

    @JsonPropertyOrder({ "states", "start_state", "input_alphabet", "output_alphabet",
        "transitions" })
    static final class MealyDocument {
        @JsonProperty("states") List<String> states;
        @JsonProperty("start_state") String startState;
        @JsonProperty("input_alphabet") List<String> inputAlphabet;
        @JsonProperty("output_alphabet") List<String> outputAlphabet;
        @JsonProperty("transitions") List<MealyTransition> transitions;
    }

    @JsonPropertyOrder({ "src", "input", "dst", "output" })
    static final class MealyTransition {
        @JsonProperty("src") String src;
        @JsonProperty("input") String input;
        @JsonProperty("dst") String dst;
        @JsonProperty("output") String output;
    }

    /*
     * Writing
     */

    static String write(FiniteAutomaton fa) {
        FiniteAutomatonDocument doc = new FiniteAutomatonDocument();
        doc.states = new ArrayList<String>(fa.states());
        doc.startState = fa.startState();
        doc.finalStates = new ArrayList<String>(fa.finalStates());
        doc.alphabet = texts(fa.alphabet());
        doc.transitions = new ArrayList<FiniteAutomatonTransition>();
        for (String state : fa.states()) {
            for (Symbol symbol : fa.symbolsFrom(state)) {
                FiniteAutomatonTransition t = new FiniteAutomatonTransition();
                t.src = state;
                t.symbol = encode(symbol);
                t.dsts = new ArrayList<String>(fa.destinations(state, symbol));
                doc.transitions.add(t);
            }
        }
        return render(doc);
    }

    static String write(PushdownAutomaton pda) {
        PushdownDocument doc = new PushdownDocument();
        doc.states = new ArrayList<String>(pda.states());
        doc.inputAlphabet = texts(pda.inputAlphabet());
        doc.stackAlphabet = new ArrayList<String>(pda.stackAlphabet());
        doc.startState = pda.startState();
        doc.startStackSymbol = pda.startStackSymbol();
        doc.finalStates = new ArrayList<String>(pda.finalStates());
        doc.transitions = new LinkedHashMap<String, List<List<String>>>();
        for (PushdownAutomaton.Transition t : pda.transitions()) {
            String key = t.source() + "," + encode(t.input()) + "," + encode(t.pop());
            List<List<String>> targets = doc.transitions.get(key);
            if (targets == null) {
                doc.transitions.put(key, targets = new ArrayList<List<String>>());
            }
            List<String> target = new ArrayList<String>(2);
            target.add(t.destination());
            target.add(encode(t.push()));
            targets.add(target);
        }
        return render(doc);
    }

    static String write(MooreMachine moore) {
        MooreDocument doc = new MooreDocument();
        doc.states = new ArrayList<String>(moore.states());
        doc.startState = moore.startState();
        doc.inputAlphabet = texts(moore.inputAlphabet());
        doc.outputAlphabet = new ArrayList<String>(moore.outputAlphabet());
        doc.outputFunction = new LinkedHashMap<String, String>();
        for (String state : moore.states()) {
            doc.outputFunction.put(state, encodeOutput(moore.output(state)));
        }
        doc.transitions = new ArrayList<MooreTransition>();
        for (Map.Entry<String, Map<Symbol, String>> e : moore.transitions().entrySet()) {
            for (Map.Entry<Symbol, String> f : e.getValue().entrySet()) {
                MooreTransition t = new MooreTransition();
                t.src = e.getKey();
                t.input = f.getKey().text();
                t.dst = f.getValue();
                doc.transitions.add(t);
            }
        }
        return render(doc);
    }

    static String write(MealyMachine mealy) {
        MealyDocument doc = new MealyDocument();
        doc.states = new ArrayList<String>(mealy.states());
        doc.startState = mealy.startState();
        doc.inputAlphabet = texts(mealy.inputAlphabet());
        doc.outputAlphabet = new ArrayList<String>(mealy.outputAlphabet());
        doc.transitions = new ArrayList<MealyTransition>();
        for (MealyMachine.Transition t : mealy.transitions()) {
            MealyTransition m = new MealyTransition();
            m.src = t.source();
            m.input = t.input().text();
            m.dst = t.destination();
            m.output = encodeOutput(t.output());
            doc.transitions.add(m);
        }
        return render(doc);
    }

    private static String render(Object doc) {
        try {
            return MAPPER.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + doc.getClass().getSimpleName(), e);
        }
    }

    /*
     * Reading
     */

    static FiniteAutomaton readFiniteAutomaton(String json) {
        JsonNode root = parse(json);
        FiniteAutomaton fa = new FiniteAutomaton();
        readStates(fa, root);
        for (JsonNode entry : elements(root, "transitions")) {
            String src = text(entry, "src");
            String symbol = text(entry, "symbol");
            JsonNode dsts = entry.get("dsts");
            if (src == null || symbol == null || dsts == null || !dsts.isArray()) {
                skip("transition", entry, null);
                continue;
            }
            for (JsonNode dst : dsts) {
                try {
                    fa.addTransition(src, decode(symbol), dst.isTextual() ? dst.asText() : null);
                } catch (AutomatonException e) {
                    skip("transition", entry, e);
                } catch (IllegalArgumentException e) {
                    skip("transition", entry, e);
                }
            }
        }
        readStart(fa, root);
        readFinals(fa, root);
        return fa;
    }

    static PushdownAutomaton readPushdownAutomaton(String json) {
        JsonNode root = parse(json);
        PushdownAutomaton pda = new PushdownAutomaton();
        readStates(pda, root);
        String stackSymbol = text(root, "start_stack_symbol");
        if (stackSymbol != null && stackSymbol.length() > 0) {
            pda.setStartStackSymbol(stackSymbol);
        } else if (root.has("start_stack_symbol")) {
            logger.log(level, "bad start stack symbol " + root.get("start_stack_symbol")
                + ", using " + pda.startStackSymbol());
        }
        JsonNode transitions = root.get("transitions");
        if (transitions != null && transitions.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> i = transitions.fields(); i.hasNext();) {
                Map.Entry<String, JsonNode> e = i.next();
                String[] parts = e.getKey().split(",", 3);
                if (parts.length != 3 || !e.getValue().isArray()) {
                    skip("transition key", e.getKey(), null);
                    continue;
                }
                for (JsonNode target : e.getValue()) {
                    if (!target.isArray() || target.size() != 2
                        || !target.get(0).isTextual() || !target.get(1).isTextual()) {
                        skip("transition " + e.getKey(), target, null);
                        continue;
                    }
                    try {
                        pda.addTransition(parts[0], decode(parts[1]), decode(parts[2]),
                            target.get(0).asText(), decode(target.get(1).asText()));
                    } catch (AutomatonException x) {
                        skip("transition " + e.getKey(), target, x);
                    } catch (IllegalArgumentException x) {
                        skip("transition " + e.getKey(), target, x);
                    }
                }
            }
        } else if (transitions != null) {
            skip("transitions", transitions, null);
        }
        readStart(pda, root);
        readFinals(pda, root);
        return pda;
    }

    static MooreMachine readMooreMachine(String json) {
        JsonNode root = parse(json);
        MooreMachine moore = new MooreMachine();
        JsonNode outputs = root.get("output_function");
        if (outputs == null || !outputs.isObject()) {
            outputs = MAPPER.createObjectNode();
        }
        for (String state : strings(root, "states")) {
            JsonNode output = outputs.get(state);
            if (output == null || !output.isTextual()) {
                logger.log(level, "state " + state + " has no output, using \"\"");
                addMooreState(moore, state, "");
            } else {
                addMooreState(moore, state, decodeOutput(output.asText()));
            }
        }
        // states known only by their output
        for (Iterator<Map.Entry<String, JsonNode>> i = outputs.fields(); i.hasNext();) {
            Map.Entry<String, JsonNode> e = i.next();
            if (!moore.containsState(e.getKey())) {
                addMooreState(moore, e.getKey(), decodeOutput(e.getValue().asText()));
            }
        }
        for (JsonNode entry : elements(root, "transitions")) {
            String src = text(entry, "src");
            String input = text(entry, "input");
            String dst = text(entry, "dst");
            try {
                moore.addTransition(src, decode(input), dst);
            } catch (AutomatonException e) {
                skip("transition", entry, e);
            } catch (IllegalArgumentException e) {
                skip("transition", entry, e);
            }
        }
        readStart(moore, root);
        return moore;
    }

    private static void addMooreState(MooreMachine moore, String state, String output) {
        try {
            moore.addState(state, output);
        } catch (IllegalArgumentException e) {
            skip("state", state, e);
        }
    }

    static MealyMachine readMealyMachine(String json) {
        JsonNode root = parse(json);
        MealyMachine mealy = new MealyMachine();
        readStates(mealy, root);
        for (JsonNode entry : elements(root, "transitions")) {
            String output = text(entry, "output");
            if (output == null) {
                skip("transition", entry, null);
                continue;
            }
            try {
                mealy.addTransition(text(entry, "src"), decode(text(entry, "input")),
                    text(entry, "dst"), decodeOutput(output));
            } catch (AutomatonException e) {
                skip("transition", entry, e);
            } catch (IllegalArgumentException e) {
                skip("transition", entry, e);
            }
        }
        readStart(mealy, root);
        return mealy;
    }

    /*
     * Shared pieces
     */

    private static JsonNode parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDataException("unreadable JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedDataException("expected a JSON object", null);
        }
        return root;
    }

    private static void readStates(AbstractAutomaton automaton, JsonNode root) {
        for (String state : strings(root, "states")) {
            try {
                if (automaton instanceof AbstractAcceptor) {
                    ((AbstractAcceptor) automaton).addState(state);
                } else {
                    ((MealyMachine) automaton).addState(state);
                }
            } catch (IllegalArgumentException e) {
                skip("state", state, e);
            }
        }
    }

    /*
     * The first state added is already the start. A missing or null start
     * clears it; an unknown one falls back to it.
     */
    private static void readStart(AbstractAutomaton automaton, JsonNode root) {
        JsonNode node = root.get("start_state");
        if (node == null || node.isNull()) {
            automaton.clearStartState();
            return;
        }
        String start = node.isTextual() ? node.asText() : null;
        if (start != null && automaton.containsState(start)) {
            automaton.setStartState(start);
        } else if (automaton.startState() != null) {
            logger.log(level, "start state " + node + " not found, using "
                + automaton.startState());
        }
    }

    private static void readFinals(AbstractAcceptor automaton, JsonNode root) {
        for (String state : strings(root, "final_states")) {
            if (automaton.containsState(state)) {
                automaton.setFinal(state, true);
            } else {
                logger.log(level, "dropping unknown final state " + state);
            }
        }
    }

    private static Iterable<JsonNode> elements(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null) return new ArrayList<JsonNode>();
        if (!node.isArray()) {
            skip(field, node, null);
            return new ArrayList<JsonNode>();
        }
        List<JsonNode> ret = new ArrayList<JsonNode>();
        for (JsonNode e : node) {
            if (e.isObject()) {
                ret.add(e);
            } else {
                skip(field + " entry", e, null);
            }
        }
        return ret;
    }

    private static List<String> strings(JsonNode root, String field) {
        List<String> ret = new ArrayList<String>();
        JsonNode node = root.get(field);
        if (node == null) return ret;
        if (!node.isArray()) {
            skip(field, node, null);
            return ret;
        }
        for (JsonNode e : node) {
            if (e.isTextual()) {
                ret.add(e.asText());
            } else {
                skip(field + " entry", e, null);
            }
        }
        return ret;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static void skip(String what, Object entry, Exception cause) {
        logger.log(level, "skipping malformed " + what + ": " + entry
            + (cause == null ? "" : " (" + cause.getMessage() + ")"));
    }

    static String encode(Symbol symbol) {
        return symbol.isEpsilon() ? EPSILON : symbol.text();
    }

    static Symbol decode(String text) {
        if (Symbol.isEpsilonMarker(text)) return Symbol.EPSILON;
        return Symbol.of(text);
    }

    /*
     * Empty outputs travel as epsilon.
     */
    private static String encodeOutput(String output) {
        return output.length() == 0 ? EPSILON : output;
    }

    private static String decodeOutput(String text) {
        return Symbol.isEpsilonMarker(text) ? "" : text;
    }

    private static List<String> texts(Iterable<Symbol> symbols) {
        List<String> ret = new ArrayList<String>();
        for (Symbol s : symbols) {
            ret.add(s.text());
        }
        return ret;
    }
}
