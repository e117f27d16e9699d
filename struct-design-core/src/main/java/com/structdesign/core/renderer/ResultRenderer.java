package com.structdesign.core.renderer;

import com.structdesign.core.model.DesignResult;

import java.util.List;

/**
 * Writes design results to a destination: the console, a JSON file, a downstream service.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). They only format
 * results; every engineering quantity they show is already in {@link DesignResult}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.structdesign.core.renderer.ResultRenderer}
 *
 * @see RenderContext
 */
public interface ResultRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used to select the renderer on the command line. Should be lowercase
     * (e.g., "console", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the results to the target destination.
     *
     * <p>Implementations should throw {@link IllegalStateException} if the destination
     * cannot be written.
     *
     * @param results design results, in input order
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if rendering fails
     */
    void render(List<DesignResult> results, RenderContext context);
}
