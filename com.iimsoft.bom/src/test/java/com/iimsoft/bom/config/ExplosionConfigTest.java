package com.iimsoft.bom.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class ExplosionConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ExplosionConfig.EXPLOSION_CONFIG_JSON_PROPERTY);
    }

    @Test
    void defaultsWhenPropertyMissing() {
        ExplosionConfig config = ExplosionConfig.load();

        assertEquals(ExplosionConfig.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertEquals(RootPolicy.STRICT, config.getRootPolicy());
        assertEquals(0.01, config.getQuantityTolerance());
    }

    @Test
    void readsJsonProperty() {
        System.setProperty(ExplosionConfig.EXPLOSION_CONFIG_JSON_PROPERTY,
                "{\"maxDepth\":8,\"rootPolicy\":\"LOWEST_ITEM\",\"unknown\":1}");

        ExplosionConfig config = ExplosionConfig.load();

        assertEquals(8, config.getMaxDepth());
        assertEquals(RootPolicy.LOWEST_ITEM, config.getRootPolicy());
        assertEquals(ExplosionConfig.DEFAULT_MAX_DISTINCT_PATHS, config.getMaxDistinctPaths());
    }

    @Test
    void fallsBackOnInvalidJson() {
        System.setProperty(ExplosionConfig.EXPLOSION_CONFIG_JSON_PROPERTY, "{maxDepth:");

        assertEquals(ExplosionConfig.DEFAULT_MAX_DEPTH, ExplosionConfig.load().getMaxDepth());
    }

    @Test
    void fallsBackOnOutOfRangeValues() {
        System.setProperty(ExplosionConfig.EXPLOSION_CONFIG_JSON_PROPERTY, "{\"maxDepth\":0}");

        assertEquals(ExplosionConfig.DEFAULT_MAX_DEPTH, ExplosionConfig.load().getMaxDepth());
    }

    @Test
    void validatesRanges() {
        assertThrows(IllegalArgumentException.class, () -> new ExplosionConfig().withMaxDistinctPaths(-1).validated());
        assertThrows(IllegalArgumentException.class, () -> new ExplosionConfig().withQuantityTolerance(-0.5).validated());
    }
}
