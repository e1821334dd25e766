package org.stianloader.shyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.shyresolve.ConfigurationException;
import org.stianloader.shyresolve.popularity.Junction;
import org.stianloader.shyresolve.popularity.PopularityStats;
import org.stianloader.shyresolve.popularity.PopularityThreshold;
import org.stianloader.shyresolve.popularity.PopularityWindow;

public class PopularityThresholdTest {

    @NotNull
    private static PopularityStats stats(long day, long week, long month) {
        return new PopularityStats("requests", day, week, month, Instant.EPOCH);
    }

    @Test
    public void testAllVersusAny() {
        PopularityStats stats = stats(150, 100, 0);
        PopularityThreshold all = PopularityThreshold.parse("last_day=100&last_week=200");
        PopularityThreshold any = PopularityThreshold.parse("or:last_day=100&last_week=200");

        assertEquals(Junction.ALL, all.getJunction());
        assertEquals(Junction.ANY, any.getJunction());
        assertFalse(all.evaluate(stats));
        assertTrue(any.evaluate(stats));
        assertTrue(all.evaluate(stats(100, 200, 0)));
        assertFalse(any.evaluate(stats(99, 199, 1_000_000)));
    }

    @Test
    public void testAndPrefix() {
        assertEquals(PopularityThreshold.parse("last_day=100&last_week=200"), PopularityThreshold.parse("and:last_day=100&last_week=200"));
    }

    @Test
    public void testBareCount() {
        PopularityThreshold threshold = PopularityThreshold.parse("10000000");
        assertEquals(Junction.ALL, threshold.getJunction());
        assertEquals(3, threshold.getMinimums().size());
        for (PopularityWindow window : PopularityWindow.values()) {
            assertEquals(10_000_000L, threshold.getMinimums().get(window));
        }
        assertFalse(threshold.evaluate(stats(1128, 7099, 28830)));
        assertFalse(threshold.evaluate(stats(10_000_000, 10_000_000, 9_999_999)));
        assertTrue(threshold.evaluate(stats(10_000_000, 20_000_000, 30_000_000)));
        assertEquals(threshold, PopularityThreshold.parse(" 10_000_000 "));
    }

    @Test
    public void testDisabled() {
        assertSame(PopularityThreshold.DISABLED, PopularityThreshold.parse(null));
        assertSame(PopularityThreshold.DISABLED, PopularityThreshold.parse(""));
        assertSame(PopularityThreshold.DISABLED, PopularityThreshold.parse("   "));
        assertFalse(PopularityThreshold.DISABLED.isEnabled());
        assertFalse(PopularityThreshold.DISABLED.evaluate(stats(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE)));
        assertEquals("", PopularityThreshold.DISABLED.toSpecification());
        assertEquals("disabled", PopularityThreshold.DISABLED.toString());
    }

    @Test
    public void testMalformed() {
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_year=5"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=5&last_day=6"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=-5"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=five"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=1.5"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=99999999999999999999"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("last_day=5&"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("or:"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("xor:last_day=5"));
        assertThrows(ConfigurationException.class, () -> PopularityThreshold.parse("-1"));
    }

    @Test
    public void testRendering() {
        PopularityThreshold threshold = PopularityThreshold.parse("or:last_week=200&last_day=1_000");
        assertEquals("or:last_week=200&last_day=1000", threshold.toSpecification());
        assertEquals("or(last_day>=1000, last_week>=200)", threshold.toString());
        assertEquals(threshold, PopularityThreshold.parse(threshold.toSpecification()));
    }

    @Test
    public void testSingleWindow() {
        PopularityThreshold threshold = PopularityThreshold.parse("or:last_day=100");
        assertTrue(threshold.isEnabled());
        assertTrue(threshold.evaluate(stats(1128, 7099, 28830)));
        assertFalse(threshold.evaluate(stats(99, 7099, 28830)));
        assertTrue(threshold.evaluate(stats(100, 0, 0)));
    }
}
