package io.github.cyfko.wilkinson.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CachePolicyTest {

    @Test
    void presets() {
        assertEquals(new CachePolicy(true, 1000), CachePolicy.defaults());
        assertEquals(500, CachePolicy.strict().cacheSize());
        assertEquals(2000, CachePolicy.relaxed().cacheSize());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(new CachePolicy(true, 50), CachePolicy.custom(50));
    }

    @Test
    void sizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(false, -3));
    }
}
