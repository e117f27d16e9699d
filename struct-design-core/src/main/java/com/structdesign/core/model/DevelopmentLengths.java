package com.structdesign.core.model;

/**
 * Detailing lengths for the main bars, rounded to whole millimeters.
 *
 * @param tension straight development length in tension
 * @param compression development length in compression
 * @param hook development length of a standard hook
 * @param splice tension lap splice length
 */
public record DevelopmentLengths(
    long tension,
    long compression,
    long hook,
    long splice
) {
}
