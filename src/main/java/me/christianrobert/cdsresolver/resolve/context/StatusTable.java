package me.christianrobert.cdsresolver.resolve.context;

import me.christianrobert.cdsresolver.model.Artifact;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table holding the status and the computed value of an on-demand
 * computation per node.
 *
 * @param <V> computed value
 */
public class StatusTable<V> {

    private final String name;
    private final Map<Artifact, NodeStatus> status = new IdentityHashMap<>();
    private final Map<Artifact, V> values = new IdentityHashMap<>();

    public StatusTable(String name) {
        this.name = name;
    }

    public NodeStatus status(Artifact node) {
        return status.getOrDefault(node, NodeStatus.UNVISITED);
    }

    public boolean isSettled(Artifact node) {
        NodeStatus current = status(node);
        return current == NodeStatus.DONE || current == NodeStatus.POISONED;
    }

    public V value(Artifact node) {
        return values.get(node);
    }

    public void begin(Artifact node) {
        NodeStatus current = status(node);
        if (current != NodeStatus.UNVISITED) {
            throw new ResolveException("Cannot start " + name + " computation in status " + current,
                    String.valueOf(node), name);
        }
        status.put(node, NodeStatus.IN_PROGRESS);
    }

    public V done(Artifact node, V value) {
        status.put(node, NodeStatus.DONE);
        values.put(node, value);
        return value;
    }

    public void poison(Artifact node) {
        status.put(node, NodeStatus.POISONED);
        values.remove(node);
    }

    public int size() {
        return status.size();
    }

    @Override
    public String toString() {
        return "StatusTable{" + name + ", nodes=" + status.size() + "}";
    }
}
