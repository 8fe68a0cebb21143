package com.questrail.testkit.expectation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Measures how similar two message types are, for choosing the best near miss
 * when an expectation fails. Lower is more similar.
 *
 * <p>Identical types have distance zero. If one type is a subtype of the
 * other, the distance is the number of supertype steps between them.
 * Otherwise the types are unrelated.</p>
 */
final class TypeDistance {

    static final int IDENTICAL = 0;
    static final int UNRELATED = Integer.MAX_VALUE;

    private TypeDistance() {
    }

    static int measure(Class<?> a, Class<?> b) {
        if (a == b) {
            return IDENTICAL;
        }
        if (a.isAssignableFrom(b)) {
            return steps(b, a);
        }
        if (b.isAssignableFrom(a)) {
            return steps(a, b);
        }
        return UNRELATED;
    }

    /**
     * Breadth-first search up the supertypes of {@code sub} for {@code sup}.
     */
    private static int steps(Class<?> sub, Class<?> sup) {
        Deque<Class<?>> queue = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        queue.add(sub);
        seen.add(sub);

        int depth = 0;
        while (!queue.isEmpty()) {
            depth++;
            for (int n = queue.size(); n > 0; n--) {
                Class<?> c = queue.removeFirst();

                Set<Class<?>> parents = new HashSet<>();
                if (c.getSuperclass() != null) {
                    parents.add(c.getSuperclass());
                }
                parents.addAll(Set.of(c.getInterfaces()));

                for (Class<?> p : parents) {
                    if (p == sup) {
                        return depth;
                    }
                    if (seen.add(p)) {
                        queue.addLast(p);
                    }
                }
            }
        }

        return UNRELATED;
    }
}
