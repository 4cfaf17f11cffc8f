package io.stagedconf.object.graph;

import io.stagedconf.object.model.ConfigObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parent/child edges between registered objects, where the parent depends on the child
 * (a service is a parent of its host). Edges are counted so an object referencing the same
 * child through two attributes keeps the edge until both are removed.
 */
public final class DependencyGraph {
    private final Map<ConfigObject, Map<ConfigObject, Integer>> parentsByChild = new IdentityHashMap<>();

    public synchronized void addDependency(final ConfigObject parent, final ConfigObject child) {
        parentsByChild.computeIfAbsent(child, c -> new IdentityHashMap<>()).merge(parent, 1, Integer::sum);
    }

    public synchronized void removeDependency(final ConfigObject parent, final ConfigObject child) {
        final Map<ConfigObject, Integer> parents = parentsByChild.get(child);
        if (parents == null) return;

        parents.computeIfPresent(parent, (p, count) -> count > 1 ? count - 1 : null);
        if (parents.isEmpty()) {
            parentsByChild.remove(child);
        }
    }

    /**
     * Objects depending on {@code child}.
     */
    public synchronized List<ConfigObject> getParents(final ConfigObject child) {
        final Map<ConfigObject, Integer> parents = parentsByChild.get(child);
        if (parents == null) return Collections.emptyList();
        return new ArrayList<>(parents.keySet());
    }

    /**
     * Objects {@code parent} depends on, once per edge.
     */
    public synchronized List<ConfigObject> getChildren(final ConfigObject parent) {
        final List<ConfigObject> children = new ArrayList<>();
        parentsByChild.forEach((child, parents) -> {
            final Integer count = parents.get(parent);
            for (int i = 0; count != null && i < count; i++) {
                children.add(child);
            }
        });
        return children;
    }

    /**
     * Hands the dependents of {@code current} over to {@code replacement}, which depends on
     * {@code children} instead of what {@code current} depended on.
     */
    public synchronized void replaceObject(final ConfigObject current,
                                           final ConfigObject replacement,
                                           final List<ConfigObject> children) {
        final Map<ConfigObject, Integer> dependents = parentsByChild.remove(current);
        parentsByChild.values().removeIf(parents -> {
            parents.remove(current);
            return parents.isEmpty();
        });

        if (dependents != null && !dependents.isEmpty()) {
            parentsByChild.put(replacement, dependents);
        }
        for (final ConfigObject child : children) {
            addDependency(replacement, child);
        }
    }

    /**
     * Drops every edge that has {@code object} on either end.
     */
    public synchronized void removeObject(final ConfigObject object) {
        parentsByChild.remove(object);
        parentsByChild.values().removeIf(parents -> {
            parents.remove(object);
            return parents.isEmpty();
        });
    }
}
