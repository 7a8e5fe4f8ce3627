/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.AbstractQueue;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static <T> boolean intersects(Collection<T> lhs, Collection<T> rhs) {
        if (lhs.size() > rhs.size()) {
            Collection<T> tmp = lhs; lhs = rhs; rhs = tmp;
        }
        for (T t : lhs) if (rhs.contains(t)) return true;
        return false;
    }

    /*
     * "{a,b,c}" - members sorted, so the label is reproducible.
     */
    static String setLabel(Collection<String> members) {
        SortedSet<String> sorted = new TreeSet<String>(members);
        StringBuilder sb = new StringBuilder();
        for (String s : sorted) {
            sb.append(sb.length() == 0 ? '{' : ',').append(s);
        }
        if (sb.length() == 0) sb.append('{');
        return sb.append('}').toString();
    }

    static <K, V> String stringFrom(String title, Map<K, V> map) {
        StringBuilder sb = new StringBuilder();
        sb.append("map: ").append(title).append(LS);
        for (Map.Entry<K, V> e : map.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }

    /**
     * FIFO queue which holds each element at most once; offering an element
     * already queued is a no-op returning false. Elements must not change
     * their hash code while queued.
     */
    static final class SetQueue<E> extends AbstractQueue<E> {

        final Set<E> set = new HashSet<E>();
        final LinkedList<E> list = new LinkedList<E>();

        public SetQueue() {
            super();
        }
        public SetQueue(Collection<? extends E> c) {
            this();
            addAll(c);
        }
        @Override
        public Iterator<E> iterator() {
            final Iterator<E> it = list.iterator();
            return new Iterator<E>() {
                private E last;
                public boolean hasNext() {
                    return it.hasNext();
                }
                public E next() {
                    return last = it.next();
                }
                public void remove() {
                    it.remove();
                    set.remove(last);
                }
            };
        }

        @Override
        public int size() {
            assert list.size() == set.size();
            return set.size();
        }

        @Override
        public boolean contains(Object o) {
            return set.contains(o);
        }

        @Override
        public boolean remove(Object o) {
            if (!set.remove(o)) return false;
            boolean removed = list.remove(o);
            assert removed;
            return true;
        }

        public boolean offer(E o) {
            if (o == null || !set.add(o)) return false;
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            boolean a = set.remove(ret);
            assert a;
            return ret;
        }
    }

    /*
     * Generic breadth first visitor over implicit graphs: visit() handles a
     * vertex and hands back its successors. Vertices are compared by equals().
     */
    static abstract class BreadthFirstVisitor<V> {

        final Set<V> black = new HashSet<V>();
        final Queue<V> gray = new SetQueue<V>();
        V vertex;

        final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.add(vertex = gray.remove());
                for (V next : visit(vertex)) {
                    if (!black.contains(next)) {
                        gray.offer(next);
                    }
                }
            }
        }

        protected abstract Iterable<V> visit(V vertex);
    }
}
