package com.reportkit.report;

import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.exception.UnknownFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Renderers by format name. Lookup ignores case.
 */
public class RendererRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RendererRegistry.class);

    private final Map<String, Renderer> renderers = new LinkedHashMap<>();

    /**
     * Registry holding the built-in formats, all sharing one calculation provider.
     */
    public static RendererRegistry withBuiltIns(CalculationProvider calculationProvider) {
        RendererRegistry registry = new RendererRegistry();
        HtmlRenderer html = new HtmlRenderer(calculationProvider);
        registry.register(new TextRenderer(calculationProvider));
        registry.register(new MarkdownRenderer(calculationProvider));
        registry.register(html);
        registry.register(new PdfRenderer(html));
        registry.register(new JsonRenderer(calculationProvider));
        return registry;
    }

    /**
     * Register a renderer, replacing any renderer with the same name.
     */
    public RendererRegistry register(Renderer renderer) {
        String key = key(renderer.getName());
        Renderer previous = renderers.put(key, renderer);
        if (previous != null && previous != renderer) {
            logger.info("Renderer '{}' replaced by {}", key, renderer.getClass().getName());
        }
        return this;
    }

    /**
     * Add renderers published through {@code META-INF/services/com.reportkit.report.Renderer}.
     *
     * @return number of renderers found
     */
    public int loadServiceProviders() {
        return loadServiceProviders(Thread.currentThread().getContextClassLoader());
    }

    public int loadServiceProviders(ClassLoader classLoader) {
        int count = 0;
        for (Renderer renderer : ServiceLoader.load(Renderer.class, classLoader)) {
            register(renderer);
            logger.debug("Discovered renderer '{}' ({})", renderer.getName(), renderer.getClass().getName());
            count++;
        }
        return count;
    }

    public Optional<Renderer> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(renderers.get(key(name)));
    }

    /**
     * @throws UnknownFormatException if no renderer has that name
     */
    public Renderer require(String name) {
        return find(name).orElseThrow(() -> new UnknownFormatException(name));
    }

    public List<Renderer> getRenderers() {
        return new ArrayList<>(renderers.values());
    }

    public List<String> getNames() {
        return new ArrayList<>(renderers.keySet());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
