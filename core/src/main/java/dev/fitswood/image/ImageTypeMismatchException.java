/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.image;

import dev.fitswood.metadata.Bitpix;

/**
 * Thrown when the data of a {@link TypedImage} is requested as an element type
 * other than the one it holds. The image itself is unaffected (unless it was
 * accessed through one of the consuming {@code take} methods), so callers may
 * catch this and retry with {@link #stored()}.
 */
public class ImageTypeMismatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Bitpix stored;
    private final Bitpix requested;

    public ImageTypeMismatchException(Bitpix stored, Bitpix requested) {
        super("Image holds " + stored.elementTypeName() + " data (BITPIX " + stored.code() + ") but "
                + requested.elementTypeName() + " data (BITPIX " + requested.code() + ") was requested");
        this.stored = stored;
        this.requested = requested;
    }

    /** The element type the image actually holds. */
    public Bitpix stored() {
        return stored;
    }

    /** The element type implied by the accessor that was called. */
    public Bitpix requested() {
        return requested;
    }
}
