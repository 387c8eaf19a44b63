package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.HierarchyKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Cycle-safe upward traversal over a parent-linked hierarchy.
 *
 * <p>The walk is lazy: parents are looked up only as the sequence is consumed.
 * Every visited id is remembered, and reaching one a second time fails the walk
 * with {@link CycleDetectedException} instead of looping.
 *
 * @param <ID> node identifier type
 */
public final class HierarchyWalker<ID> {

    public static final HierarchyWalker<String> TENANTS = new HierarchyWalker<>(HierarchyKind.TENANT);
    public static final HierarchyWalker<String> ROLES = new HierarchyWalker<>(HierarchyKind.ROLE);
    public static final HierarchyWalker<String> GROUPS = new HierarchyWalker<>(HierarchyKind.GROUP);

    private final HierarchyKind kind;

    public HierarchyWalker(HierarchyKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Ancestors of {@code startId}, nearest first, excluding the start node.
     *
     * @param parentOf returns the parent id, or null at a root
     */
    public Iterable<ID> ancestors(ID startId, Function<ID, ID> parentOf) {
        Objects.requireNonNull(startId, "startId");
        Objects.requireNonNull(parentOf, "parentOf");
        return () -> new AncestorIterator(startId, parentOf);
    }

    /**
     * Eagerly collects the ancestor chain.
     *
     * @throws CycleDetectedException if the chain loops
     */
    public List<ID> collectAncestors(ID startId, Function<ID, ID> parentOf) {
        List<ID> result = new ArrayList<>();
        for (ID id : ancestors(startId, parentOf)) {
            result.add(id);
        }
        return result;
    }

    /**
     * True when {@code candidate} is {@code startId} itself or one of its ancestors.
     *
     * @throws CycleDetectedException if the chain loops before the candidate is found
     */
    public boolean isSelfOrAncestor(ID candidate, ID startId, Function<ID, ID> parentOf) {
        if (Objects.equals(candidate, startId)) {
            return true;
        }
        for (ID id : ancestors(startId, parentOf)) {
            if (Objects.equals(candidate, id)) {
                return true;
            }
        }
        return false;
    }

    private final class AncestorIterator implements Iterator<ID> {

        private final ID startId;
        private final Function<ID, ID> parentOf;
        private final Set<ID> visited = new LinkedHashSet<>();
        private ID current;
        private ID pending;
        private boolean resolved;

        private AncestorIterator(ID startId, Function<ID, ID> parentOf) {
            this.startId = startId;
            this.parentOf = parentOf;
            this.current = startId;
            this.visited.add(startId);
        }

        @Override
        public boolean hasNext() {
            if (!resolved) {
                pending = parentOf.apply(current);
                resolved = true;
                if (pending != null && !visited.add(pending)) {
                    throw new CycleDetectedException(kind, String.valueOf(startId), String.valueOf(pending));
                }
            }
            return pending != null;
        }

        @Override
        public ID next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            current = pending;
            pending = null;
            resolved = false;
            return current;
        }
    }
}
