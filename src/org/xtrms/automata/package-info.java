/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-automata</b> - finite automata, pushdown automata and finite
 * state transducers for teaching and experimentation.</h3>
 * <p>
 * <h4>Automaton kinds.</h4>
 * <p>
 * {@link org.xtrms.automata.FiniteAutomaton} covers both NFAs (with epsilon
 * moves) and DFAs; whether a given instance is deterministic is a property,
 * see {@link org.xtrms.automata.FiniteAutomaton#isDfa()}. Beyond simulation
 * it offers subset construction, minimization and conversion to a
 * {@link org.xtrms.automata.RegularGrammar}.
 * {@link org.xtrms.automata.PushdownAutomaton} accepts by final state, with
 * a bounded search over configurations.
 * {@link org.xtrms.automata.MooreMachine} and
 * {@link org.xtrms.automata.MealyMachine} are deterministic transducers
 * producing an output string, or none when the run gets stuck.
 * <p>
 * <h4>Symbols.</h4>
 * <p>
 * Transition labels are {@link org.xtrms.automata.Symbol}s: non-empty strings,
 * not single characters, plus the distinguished
 * {@link org.xtrms.automata.Symbol#EPSILON}. Simulation therefore moves over
 * the input by position; which of several matching symbols is followed at a
 * position is decided by a {@link org.xtrms.automata.SymbolSelector}. The
 * default, {@link org.xtrms.automata.MatchPolicy#LONGEST_MATCH}, is greedy:
 * the longest symbol which is a prefix of the remaining input wins, and no
 * other alternative is explored. {@link org.xtrms.automata.MatchPolicy#ALL_MATCHES}
 * explores every matching symbol instead.
 * <p>
 * <h4>Persistence.</h4>
 * <p>
 * Every kind has {@code toJson()} and a static {@code fromJson(String)}.
 * Loading is lenient: malformed transitions are skipped and logged at
 * {@code WARNING} on the {@code org.xtrms.automata} logger.
 * <p>
 * <h4>Errors.</h4>
 * <p>
 * All exceptions thrown for misuse are unchecked and extend
 * {@link org.xtrms.automata.AutomatonException}. A run which cannot consume
 * its input is not an error; it is reported through
 * {@link org.xtrms.automata.Run#stuck()}.
 */
package org.xtrms.automata;
