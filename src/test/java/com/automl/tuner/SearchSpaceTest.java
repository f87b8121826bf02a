package com.automl.tuner;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchSpaceTest {

    @Test
    void intParameterShouldSampleAcrossFullIntRange() {
        SearchSpace.UniformInt parameter = new SearchSpace.UniformInt(Integer.MIN_VALUE, Integer.MAX_VALUE);
        Random random = new Random(7L);

        for (int i = 0; i < 100; i++) {
            assertTrue(parameter.sample(random) instanceof Integer);
        }
    }

    @Test
    void intGridShouldNotOverflowOnWideRanges() {
        SearchSpace.UniformInt parameter = new SearchSpace.UniformInt(-2_000_000_000, 2_000_000_000);

        assertEquals(List.of(-2_000_000_000, 0, 2_000_000_000), parameter.grid(3));
        assertEquals(List.of(0), parameter.grid(1));
    }

    @Test
    void intGridShouldEnumerateSmallRangeAtUpperBound() {
        SearchSpace.UniformInt parameter = new SearchSpace.UniformInt(Integer.MAX_VALUE - 1, Integer.MAX_VALUE);

        assertEquals(List.of(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), parameter.grid(5));
    }

    @Test
    void shouldRejectInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new SearchSpace.UniformInt(5, 1));
        assertThrows(IllegalArgumentException.class, () -> new SearchSpace.UniformDouble(0, 1, true));
        assertThrows(IllegalArgumentException.class, () -> new SearchSpace.Choice(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> SearchSpace.builder().uniformInt("x", 1, 2).uniformInt("x", 1, 2));
    }
}
