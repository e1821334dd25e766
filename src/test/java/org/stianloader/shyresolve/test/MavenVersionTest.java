package org.stianloader.shyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.shyresolve.version.MavenVersion;

public class MavenVersionTest {

    private static void assertNewer(@NotNull String newer, @NotNull String older) {
        MavenVersion a = MavenVersion.parse(newer);
        MavenVersion b = MavenVersion.parse(older);
        assertTrue(a.isNewerThan(b), newer + " should be newer than " + older);
        assertFalse(b.isNewerThan(a), older + " should not be newer than " + newer);
    }

    private static void assertSame(@NotNull String a, @NotNull String b) {
        MavenVersion va = MavenVersion.parse(a);
        MavenVersion vb = MavenVersion.parse(b);
        assertFalse(va.isNewerThan(vb), a + " should not be newer than " + b);
        assertFalse(vb.isNewerThan(va), b + " should not be newer than " + a);
        assertEquals(va, vb);
        assertEquals(va.hashCode(), vb.hashCode());
    }

    @Test
    public void testAliases() {
        assertSame("1.0-rc", "1.0-cr");
        assertSame("1.0-ga", "1.0.ga");
        assertSame("1-final", "1");
        assertSame("1-release", "1.0.0");
        assertSame("1-a1", "1-alpha-1");
        assertSame("2.0-b3", "2.0-beta-3");
        assertSame("2.0-m1", "2.0-milestone-1");
        assertSame("1.0-RC1", "1.0-rc1");
    }

    @Test
    public void testCandidateVersions() {
        assertNewer("1.3.1", "1.3.0");
        assertNewer("1.10", "1.9");
        assertNewer("2.0.0", "1.99.99");
        assertNewer("1.0.10.2", "1.0.9.3");
        assertNewer("1.2-12", "1.2-11");
        assertNewer("1.2-beta-2", "1.2-alpha-6");
        assertNewer("1.0.0-alpha", "0.99.9-gamma");
        assertSame("1.0", "1");
        assertSame("1.3.0", "1.3");
    }

    @Test
    public void testOriginText() {
        MavenVersion version = MavenVersion.parse("1.3.0-SNAPSHOT");
        assertEquals("1.3.0-SNAPSHOT", version.getOriginText());
        assertEquals("1.3.0-SNAPSHOT", version.toString());
        assertNotEquals(MavenVersion.parse("1.3.0"), version);
    }

    @Test
    public void testQualifierOrder() {
        assertNewer("1.0-beta", "1.0-alpha");
        assertNewer("1.0-milestone", "1.0-beta");
        assertNewer("1.0-rc", "1.0-milestone");
        assertNewer("1.0-snapshot", "1.0-rc");
        assertNewer("1.0", "1.0-snapshot");
        assertNewer("1.0-sp", "1.0");
        assertNewer("1.0-sp", "1.0-ga");
        assertNewer("1.0-sp.1", "1.0-ga.1");
        assertNewer("1.0-aab", "1.0-aaa");
        assertNewer("1.0-aaa", "1.0-alpha");
        assertNewer("1.0.aaa", "1.0");
        assertNewer("1-foo10", "1-foo2");
    }

    @Test
    public void testSeparators() {
        assertNewer("1-foo", "1.foo");
        assertNewer("1-1", "1-foo");
        assertNewer("1.1", "1-1");
        assertNewer("1.0.alpha", "1.0-aaa");
        assertNewer("1-1", "1-ga-1");
        assertSame("1-1.foo-bar1baz-.1", "1-1.foo-bar-1-baz-0.1");
    }

    @Test
    public void testSnapshots() {
        assertNewer("5", "5-SNAPSHOT");
        assertNewer("1.2", "1.0-SNAPSHOT");
        assertNewer("1.2-SNAPSHOT", "1.0");
        assertNewer("1.2.3", "1.2.3-SNAPSHOT");
        assertSame("1.0-SNAPSHOT", "1.0-snapshot");
    }

    @Test
    public void testUnusualInput() {
        MavenVersion.parse("");
        MavenVersion.parse("0-0-1");
        MavenVersion.parse(".1");
        MavenVersion.parse("0.foo");
        assertNewer("0.1-max-version", "0-min-version");
        assertNewer("3.3.0-I20070605-0010", "3.3.0");
        assertNewer("1", "");
    }
}
