package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.resolve.cycle.StronglyConnectedComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layers of the sources for the annotation merge.  Sources which depend on
 * each other (directly or through a cycle) form one layer; a layer extends
 * every layer it depends on transitively.
 *
 * <p>Computed on first use, as the linker may still add source dependencies.
 */
public class LayerGraph {

    private static final Logger log = LoggerFactory.getLogger(LayerGraph.class);

    private final List<Source> sources;
    private Map<Source, Source> representatives;
    private Map<Source, Set<Source>> extendedLayers;
    private Map<Source, Integer> layerNumbers;

    public LayerGraph(List<Source> sources) {
        this.sources = sources;
    }

    /** The representative source of the layer of {@code source}, {@code null} for {@code null}. */
    public Source layer(Source source) {
        if (source == null) {
            return null;
        }
        compute();
        Source representative = representatives.get(source);
        return representative != null ? representative : source;
    }

    /** True if the layer of {@code upper} extends the layer of {@code lower}. */
    public boolean isExtending(Source upper, Source lower) {
        if (upper == null || lower == null) {
            return false;
        }
        Set<Source> extended = extendedLayers(upper);
        return extended.contains(layer(lower));
    }

    /** The representatives of all layers the layer of {@code source} extends. */
    public Set<Source> extendedLayers(Source source) {
        if (source == null) {
            return Collections.emptySet();
        }
        compute();
        Set<Source> extended = extendedLayers.get(layer(source));
        return extended != null ? extended : Collections.emptySet();
    }

    /** Position of the layer in dependency order; lower layers have smaller numbers. */
    public int layerNumber(Source source) {
        compute();
        Integer number = layerNumbers.get(layer(source));
        return number != null ? number : 0;
    }

    private void compute() {
        if (representatives != null) {
            return;
        }
        representatives = new IdentityHashMap<>();
        extendedLayers = new IdentityHashMap<>();
        layerNumbers = new IdentityHashMap<>();
        // dependencies come first, so the extended layers of a dependency are complete
        List<List<Source>> components = StronglyConnectedComponents.of(sources, Source::getDependencies);
        int number = 0;
        for (List<Source> component : components) {
            Source representative = component.get(component.size() - 1);
            number++;
            layerNumbers.put(representative, number);
            for (Source member : component) {
                representatives.put(member, representative);
            }
            Set<Source> extended = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Source member : component) {
                for (Source dependency : member.getDependencies()) {
                    Source depLayer = representatives.get(dependency);
                    if (depLayer != null && depLayer != representative) {
                        extended.add(depLayer);
                        extended.addAll(extendedLayers.getOrDefault(depLayer, Collections.emptySet()));
                    }
                }
            }
            extendedLayers.put(representative, extended);
        }
        log.debug("{} sources form {} layers", sources.size(), number);
    }
}
