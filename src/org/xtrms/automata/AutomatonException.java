/*
 * @LICENSE@
 */
package org.xtrms.automata;

/**
 * Root of the runtime exceptions thrown by the automata in this package.
 * Getting stuck during a simulation is <em>not</em> reported with an
 * exception; see {@link Run#stuck()}.
 */
public abstract class AutomatonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    AutomatonException(String msg) {
        super(msg);
    }

    AutomatonException(String msg, Throwable cause) {
        super(msg, cause);
    }

    /**
     * A transition, start or final flag, or rename names a state the
     * automaton does not have. The automaton is left unchanged.
     */
    public static final class UnknownStateException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        private final String state;

        public UnknownStateException(String state) {
            super("no such state: " + state);
            this.state = state;
        }

        public String state() {
            return state;
        }
    }

    /**
     * A rename targets a name already taken by a different state.
     */
    public static final class NameConflictException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public NameConflictException(String name) {
            super("state name already in use: " + name);
        }
    }

    /**
     * An operation was invoked on an automaton which does not meet its
     * requirements, e.g. minimizing something that is not a DFA.
     */
    public static final class PreconditionException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public PreconditionException(String msg) {
            super(msg);
        }
    }

    /**
     * A search or construction exceeded its configured bound.
     */
    public static final class ResourceExhaustedException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public ResourceExhaustedException(String msg) {
            super(msg);
        }
    }

    /**
     * A persisted automaton could not be read at all. Individual bad
     * transitions do not raise this; they are skipped.
     */
    public static final class MalformedDataException extends AutomatonException {

        private static final long serialVersionUID = 1L;

        public MalformedDataException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}
