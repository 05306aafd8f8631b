package me.christianrobert.cdsresolver.resolve.cycle;

import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StronglyConnectedComponentsTest {

    private final Map<String, List<String>> edges = new HashMap<>();

    private Collection<String> successors(String node) {
        return edges.getOrDefault(node, List.of());
    }

    @Test
    void acyclicGraphHasSingletonComponents() {
        edges.put("a", List.of("b"));
        edges.put("b", List.of("c"));

        List<List<String>> components = StronglyConnectedComponents.of(List.of("a", "b", "c"), this::successors);

        assertEquals(3, components.size());
        components.forEach(c -> assertEquals(1, c.size()));
    }

    @Test
    void cycleFormsOneComponent() {
        edges.put("a", List.of("b"));
        edges.put("b", List.of("a"));
        edges.put("c", List.of("a"));

        List<List<String>> components = StronglyConnectedComponents.of(List.of("c", "a", "b"), this::successors);

        assertEquals(2, components.size());
        assertEquals(2, components.get(0).size());
        assertTrue(components.get(0).containsAll(List.of("a", "b")));
        assertEquals(List.of("c"), components.get(1));
    }

    @Test
    void componentsComeAfterTheComponentsTheyReach() {
        edges.put("top", List.of("middle"));
        edges.put("middle", List.of("bottom"));

        List<List<String>> components = StronglyConnectedComponents.of(List.of("top"), this::successors);

        assertEquals(List.of(List.of("bottom"), List.of("middle"), List.of("top")), components);
    }

    @Test
    void successorsOutsideTheNodeListAreVisited() {
        edges.put("a", List.of("x"));
        edges.put("x", List.of("a"));

        List<List<String>> components = StronglyConnectedComponents.of(List.of("a"), this::successors);

        assertEquals(1, components.size());
        assertEquals(2, components.get(0).size());
    }
}
