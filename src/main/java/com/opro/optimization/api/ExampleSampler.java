package com.opro.optimization.api;

import java.util.List;

/**
 * Picks {@code n} of {@code m} items uniformly without replacement.
 */
public interface ExampleSampler {

    /**
     * @return {@code min(n, items.size())} distinct items.
     */
    <T> List<T> sample(List<T> items, int n);
}
