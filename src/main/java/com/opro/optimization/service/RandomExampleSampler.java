package com.opro.optimization.service;

import com.opro.optimization.api.ExampleSampler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Component
public class RandomExampleSampler implements ExampleSampler {

    private final Random random;

    public RandomExampleSampler() {
        this(new Random());
    }

    public RandomExampleSampler(Random random) {
        this.random = random;
    }

    @Override
    public <T> List<T> sample(List<T> items, int n) {
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(n, shuffled.size())));
    }
}
