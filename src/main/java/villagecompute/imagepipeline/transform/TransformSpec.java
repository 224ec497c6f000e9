/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * Ordered, immutable sequence of operations. Operation order is significant and is never rearranged.
 *
 * <p>
 * Two specs are equal when their operations are equal in order; because every operation normalizes its parameters on
 * construction this is the same as comparing {@link #canonical()} strings.
 */
public record TransformSpec(List<TransformOperation> operations) {

    private static final TransformSpec EMPTY = new TransformSpec(List.of());

    public TransformSpec {
        Objects.requireNonNull(operations, "operations");
        operations = List.copyOf(operations);
    }

    public static TransformSpec of(TransformOperation... operations) {
        return new TransformSpec(List.of(operations));
    }

    public static TransformSpec empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Canonical encoding, e.g. {@code resize(width=400)|rotate(degrees=90)}. Empty specs encode as the empty string.
     */
    public String canonical() {
        return operations.stream().map(TransformOperation::canonical).collect(Collectors.joining("|"));
    }

    /**
     * Resolves the encoding of the result: the target of the last {@code format} operation, otherwise the requested
     * format.
     */
    public OutputFormat effectiveFormat(OutputFormat requested) {
        OutputFormat result = requested;
        for (TransformOperation operation : operations) {
            if (operation instanceof TransformOperation.Format format) {
                result = format.target();
            }
        }
        if (result == null) {
            throw new ValidationException("Output format is required");
        }
        return result;
    }

    /**
     * Walks the operations over the given source size, validating bounds and the pixel budget for the source and at
     * every step.
     *
     * @param source
     *            dimensions of the source image
     * @param maxPixels
     *            largest intermediate image allowed (width * height)
     * @return dimensions of the final image
     * @throws ValidationException
     *             if the source or any intermediate exceeds the budget, or an operation does not fit its input
     */
    public Dimensions plan(Dimensions source, long maxPixels) {
        if (source.pixels() > maxPixels) {
            throw new ValidationException(
                    "Source image " + source + " exceeds the pixel budget of " + maxPixels);
        }
        Dimensions current = source;
        for (int i = 0; i < operations.size(); i++) {
            TransformOperation operation = operations.get(i);
            current = operation.outputDimensions(current);
            if (current.pixels() > maxPixels) {
                throw new ValidationException("Operation " + (i + 1) + " (" + operation.kind().wireName()
                        + ") would produce " + current + " which exceeds the pixel budget of " + maxPixels);
            }
        }
        return current;
    }

    /**
     * Image ids referenced by watermark operations, in order of appearance.
     */
    public List<String> overlayReferences() {
        return operations.stream().filter(TransformOperation.Watermark.class::isInstance)
                .map(op -> ((TransformOperation.Watermark) op).overlay()).distinct().toList();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
