package com.foodinsight.pipeline.service;

import com.foodinsight.pipeline.model.Region;

import lombok.Getter;

/**
 * Raised when a region update is malformed. The previously configured region stays in effect.
 */
@Getter
public class InvalidRegionException extends IllegalArgumentException {

    private final transient Region rejected;

    public InvalidRegionException(Region rejected, String reason) {
        super("Rejected region " + rejected + ": " + reason);
        this.rejected = rejected;
    }
}
