/*
 * @LICENSE@
 */
package org.xtrms.automata;

/**
 * A right-linear production {@code lhs -> terminal next}. The terminal may be
 * {@link Symbol#EPSILON}, and {@code next} may be absent, giving the forms
 * {@code A -> a B}, {@code A -> a} and {@code A -> ε}.
 */
public final class Production {

    private final String lhs;
    private final Symbol terminal;
    private final String next;

    Production(String lhs, Symbol terminal, String next) {
        assert lhs != null && terminal != null;
        this.lhs = lhs;
        this.terminal = terminal;
        this.next = next;
    }

    public String lhs() {
        return lhs;
    }

    public Symbol terminal() {
        return terminal;
    }

    /**
     * @return the trailing nonterminal, or null
     */
    public String next() {
        return next;
    }

    /*
     * right hand side only, as printed after "->"
     */
    String rhs() {
        if (next == null) return terminal.toString();
        return terminal.isEpsilon() ? next : terminal + " " + next;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = lhs.hashCode();
        result = prime * result + terminal.hashCode();
        result = prime * result + (next == null ? 0 : next.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Production)) return false;
        final Production p = (Production) o;
        return lhs.equals(p.lhs) && terminal.equals(p.terminal)
            && (next == null ? p.next == null : next.equals(p.next));
    }

    @Override
    public String toString() {
        return lhs + " -> " + rhs();
    }
}
