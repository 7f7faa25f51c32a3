package com.specharvest.core.renderer;

import com.specharvest.core.model.Specification;

/**
 * Renders an extracted {@link Specification} tree into a textual output format.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by
 * id in configuration ({@code output.formats}) or on the command line ({@code --format}).
 *
 * <p>Every renderer must honor the same presence and ordering rules:
 * <ul>
 *   <li>Requirement fields in the order Reference, Description, ThreatReference</li>
 *   <li>Test case fields in the order Purpose, PreConditions, ExecutionSteps,
 *       ExpectedResults, EvidenceFormat</li>
 *   <li>Fields without a value are omitted, never emitted empty</li>
 * </ul>
 * {@link RecordFields} yields the fields in that order.
 *
 * <p>Rendering must be deterministic: the same tree always yields the same text.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.specharvest.core.renderer.SpecificationRenderer}
 *
 * @see SpecificationRenderers
 */
public interface SpecificationRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for referencing the renderer in configuration. Should be lowercase
     * (e.g., "xml", "json", "markdown").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for rendered output.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns the MIME type of rendered output.
     *
     * @return content type
     */
    String getContentType();

    /**
     * Renders a specification tree.
     *
     * @param specification tree to render
     * @return rendered text
     */
    String render(Specification specification);
}
