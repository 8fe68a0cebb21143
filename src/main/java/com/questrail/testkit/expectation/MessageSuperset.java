package com.questrail.testkit.expectation;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether one value is a superset of another, ignoring the parts of
 * the subset that were left empty.
 *
 * <ul>
 *   <li>records of the same class: each component of the superset covers the
 *       matching component of the subset, unless that component is empty</li>
 *   <li>collections: every element of the subset is covered by some element
 *       of the superset, in any order</li>
 *   <li>maps: every key of the subset is present, with a covering value</li>
 *   <li>anything else: {@link Objects#equals}</li>
 * </ul>
 *
 * <p>A value is empty if it is null, a primitive default, an empty string or
 * an empty collection or map.</p>
 */
final class MessageSuperset {

    private MessageSuperset() {
    }

    static boolean isSuperset(Object sup, Object sub) {
        if (isEmpty(sub)) {
            return true;
        }
        if (sup == null) {
            return false;
        }

        if (sub.getClass().isRecord()) {
            return sup.getClass() == sub.getClass() && recordCovers(sup, sub);
        }
        if (sub instanceof Collection<?> subs) {
            return sup instanceof Collection<?> sups && collectionCovers(sups, subs);
        }
        if (sub instanceof Map<?, ?> subs) {
            return sup instanceof Map<?, ?> sups && mapCovers(sups, subs);
        }
        return Objects.equals(sup, sub);
    }

    private static boolean recordCovers(Object sup, Object sub) {
        for (RecordComponent c : sub.getClass().getRecordComponents()) {
            Method accessor = c.getAccessor();
            accessor.setAccessible(true);

            Object a;
            Object b;
            try {
                a = accessor.invoke(sup);
                b = accessor.invoke(sub);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("cannot read record component " + c.getName(), e);
            }

            if (!isSuperset(a, b)) {
                return false;
            }
        }
        return true;
    }

    private static boolean collectionCovers(Collection<?> sup, Collection<?> sub) {
        List<Object> candidates = new ArrayList<>(sup);
        for (Object b : sub) {
            if (candidates.stream().noneMatch(a -> isSuperset(a, b))) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapCovers(Map<?, ?> sup, Map<?, ?> sub) {
        for (Map.Entry<?, ?> e : sub.entrySet()) {
            if (!sup.containsKey(e.getKey()) || !isSuperset(sup.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEmpty(Object v) {
        if (v == null) {
            return true;
        }
        if (v instanceof Boolean b) {
            return !b;
        }
        if (v instanceof Character c) {
            return c == '\0';
        }
        if (v instanceof Number n) {
            return isZero(n);
        }
        if (v instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (v instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (v instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }

    private static boolean isZero(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return n.doubleValue() == 0;
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.longValue() == 0;
        }
        return false;
    }
}
