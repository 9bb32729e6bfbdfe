package com.booking.sync.core.util;

import com.booking.sync.core.exception.CyclicDependencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Orders items so that every item comes after the items it depends on. Items keep their input order where the
 * dependencies allow it.
 */
public final class DependencySorter {

    private enum Mark {
        VISITING,
        VISITED
    }

    private DependencySorter() {
    }

    public static <T> List<T> sort(List<T> items, Function<T, List<T>> dependencies) throws CyclicDependencyException {
        Map<T, Boolean> members = new IdentityHashMap<>();

        for (T item : items) {
            members.put(item, Boolean.TRUE);
        }

        Map<T, Mark> marks = new IdentityHashMap<>();
        List<T> sorted = new ArrayList<>(items.size());

        for (T item : items) {
            DependencySorter.visit(item, dependencies, members, marks, new ArrayList<>(), sorted);
        }

        return sorted;
    }

    public static <T> List<T> sortReversed(List<T> items, Function<T, List<T>> dependencies) throws CyclicDependencyException {
        List<T> sorted = DependencySorter.sort(items, dependencies);

        Collections.reverse(sorted);

        return sorted;
    }

    private static <T> void visit(T item, Function<T, List<T>> dependencies, Map<T, Boolean> members, Map<T, Mark> marks, List<T> path, List<T> sorted) throws CyclicDependencyException {
        Mark mark = marks.get(item);

        if (mark == Mark.VISITED) {
            return;
        }

        if (mark == Mark.VISITING) {
            List<T> cycle = new ArrayList<>(path.subList(path.indexOf(item), path.size()));

            cycle.add(item);

            throw new CyclicDependencyException(cycle);
        }

        marks.put(item, Mark.VISITING);
        path.add(item);

        List<T> parents = dependencies.apply(item);

        if (parents != null) {
            for (T parent : parents) {
                if (parent != item && members.containsKey(parent)) {
                    DependencySorter.visit(parent, dependencies, members, marks, path, sorted);
                }
            }
        }

        path.remove(path.size() - 1);
        marks.put(item, Mark.VISITED);
        sorted.add(item);
    }
}
