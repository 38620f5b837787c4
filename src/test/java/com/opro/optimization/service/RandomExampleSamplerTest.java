package com.opro.optimization.service;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RandomExampleSamplerTest {

    private final RandomExampleSampler sampler = new RandomExampleSampler(new Random(42));

    @Test
    void testSampleWithoutReplacement() {
        List<Integer> items = List.of(1, 2, 3, 4, 5, 6, 7, 8);

        List<Integer> sample = sampler.sample(items, 3);

        assertEquals(3, sample.size());
        assertEquals(3, new HashSet<>(sample).size());
        assertTrue(items.containsAll(sample));
    }

    @Test
    void testSampleClampedToSize() {
        List<String> sample = sampler.sample(List.of("a", "b"), 3);
        assertEquals(2, sample.size());
        assertTrue(sampler.sample(List.of(), 3).isEmpty());
    }
}
