package com.lifebutler.assistant.client;

import java.util.List;

/**
 * Turns texts into fixed-length vectors. Implementations may throw on any failure; callers
 * fall back.
 */
public interface Embedder {

    List<List<Double>> embed(List<String> texts);

    /** Dimension of the vectors this provider returns. */
    int expectedDimension();
}
