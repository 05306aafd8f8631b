package me.christianrobert.cdsresolver.resolve.cycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Tarjan's algorithm over an implicit graph.  Nodes are compared by identity.
 *
 * <p>Components are returned in reverse topological order: a component comes
 * after all components it has edges to.
 */
public final class StronglyConnectedComponents<T> {

    private final Function<T, Collection<T>> successors;
    private final Map<T, int[]> index = new IdentityHashMap<>();   // {index, lowlink}
    private final Map<T, Boolean> onStack = new IdentityHashMap<>();
    private final Deque<T> stack = new ArrayDeque<>();
    private final List<List<T>> components = new ArrayList<>();
    private int counter;

    private StronglyConnectedComponents(Function<T, Collection<T>> successors) {
        this.successors = successors;
    }

    public static <T> List<List<T>> of(Collection<T> nodes, Function<T, Collection<T>> successors) {
        StronglyConnectedComponents<T> scc = new StronglyConnectedComponents<>(successors);
        for (T node : nodes) {
            if (!scc.index.containsKey(node)) {
                scc.connect(node);
            }
        }
        return scc.components;
    }

    private void connect(T node) {
        int[] data = { counter, counter };
        counter++;
        index.put(node, data);
        stack.push(node);
        onStack.put(node, Boolean.TRUE);

        for (T next : successors.apply(node)) {
            int[] nextData = index.get(next);
            if (nextData == null) {
                connect(next);
                data[1] = Math.min(data[1], index.get(next)[1]);
            } else if (onStack.containsKey(next)) {
                data[1] = Math.min(data[1], nextData[0]);
            }
        }

        if (data[1] == data[0]) {
            List<T> component = new ArrayList<>();
            T member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (member != node);
            components.add(component);
        }
    }
}
