package com.specharvest.core.pipeline;

import com.specharvest.core.model.SpecificationId;

/**
 * Raised when the extracted tree of a specification cannot be serialized or written.
 */
public class ExtractionException extends RuntimeException {

    private final transient SpecificationId specificationId;

    public ExtractionException(SpecificationId specificationId, String message, Throwable cause) {
        super(specificationId + ": " + message, cause);
        this.specificationId = specificationId;
    }

    public SpecificationId getSpecificationId() {
        return specificationId;
    }
}
