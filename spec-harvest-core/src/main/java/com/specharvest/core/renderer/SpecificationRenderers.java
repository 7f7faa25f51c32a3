package com.specharvest.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link SpecificationRenderer} implementations via {@link ServiceLoader}.
 */
public final class SpecificationRenderers {

    private static final Logger log = LoggerFactory.getLogger(SpecificationRenderers.class);

    private SpecificationRenderers() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns all registered renderers sorted by id.
     *
     * @return discovered renderers
     */
    public static List<SpecificationRenderer> discover() {
        ServiceLoader<SpecificationRenderer> loader = ServiceLoader.load(SpecificationRenderer.class);
        List<SpecificationRenderer> renderers = new ArrayList<>();
        loader.forEach(renderers::add);
        renderers.sort(Comparator.comparing(SpecificationRenderer::getId));
        log.debug("Discovered {} specification renderers", renderers.size());
        return renderers;
    }

    /**
     * Finds a renderer by id (case-insensitive).
     *
     * @param id renderer id
     * @return the renderer, or empty if none is registered under that id
     */
    public static Optional<SpecificationRenderer> find(String id) {
        return discover().stream()
            .filter(renderer -> renderer.getId().equalsIgnoreCase(id))
            .findFirst();
    }

    /**
     * Resolves a list of renderer ids.
     *
     * @param ids renderer ids
     * @return renderers in the order requested
     * @throws IllegalArgumentException if an id is unknown
     */
    public static List<SpecificationRenderer> resolve(Collection<String> ids) {
        List<SpecificationRenderer> available = discover();
        List<SpecificationRenderer> resolved = new ArrayList<>();
        for (String id : ids) {
            SpecificationRenderer renderer = available.stream()
                .filter(r -> r.getId().equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + id
                    + ". Available: " + available.stream().map(SpecificationRenderer::getId).toList()));
            resolved.add(renderer);
        }
        return resolved;
    }
}
