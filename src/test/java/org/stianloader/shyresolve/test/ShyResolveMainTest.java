package org.stianloader.shyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.shyresolve.ShyConfiguration;
import org.stianloader.shyresolve.cli.ShyResolveMain;

public class ShyResolveMainTest {

    @TempDir
    Path cacheDir;

    private final Map<String, String> env = new HashMap<>();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @NotNull
    private String err() {
        return new String(this.err.toByteArray(), StandardCharsets.UTF_8);
    }

    @NotNull
    private String out() {
        return new String(this.out.toByteArray(), StandardCharsets.UTF_8);
    }

    private int run(@NotNull String... args) {
        return ShyResolveMain.run(args, this.env::get, new PrintStream(this.out, true, StandardCharsets.UTF_8), new PrintStream(this.err, true, StandardCharsets.UTF_8));
    }

    @BeforeEach
    public void setup() {
        this.env.put(ShyConfiguration.ENV_CACHE, this.cacheDir.toString());
        this.env.put(ShyConfiguration.ENV_PROMPT, "no");
    }

    @Test
    public void testAbort() {
        int status = this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/", "1.3.1@https://pypi.org/simple/sampleproject/");
        assertEquals(ShyResolveMain.EXIT_ABORT, status);
        assertEquals("", this.out());
        assertTrue(this.err().contains("multiple possible repository sources for sampleproject"), this.err());
        assertTrue(this.err().contains("1 trusted, 1 untrusted candidate(s)"), this.err());
    }

    @Test
    public void testDumpConfig() {
        this.env.put(ShyConfiguration.ENV_DUMP_CONFIG, "1");
        assertEquals(ShyResolveMain.EXIT_SUCCESS, this.run());
        assertTrue(this.err().contains("SHYRESOLVE_UNTRUSTED=pypi.org,files.pythonhosted.org"), this.err());
        assertTrue(this.err().contains("SHYRESOLVE_CACHE=" + this.cacheDir), this.err());
        assertEquals("", this.out());
    }

    @Test
    public void testInvalidConfiguration() {
        this.env.put(ShyConfiguration.ENV_POPULARITY, "last_decade=5");
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/"));
        assertTrue(this.err().contains("last_decade"), this.err());
    }

    @Test
    public void testSelection() {
        int status = this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/", "1.2.9@https://pypi.org/simple/sampleproject/");
        assertEquals(ShyResolveMain.EXIT_SUCCESS, status, this.err());
        assertEquals("sampleproject 1.3.0 pkgs.example.com", this.out().trim());
    }

    @Test
    public void testCacheFileInsteadOfDirectory() throws IOException {
        Path file = Files.createFile(this.cacheDir.resolve("cache-file"));
        this.env.put(ShyConfiguration.ENV_CACHE, file.toString());

        assertEquals(ShyResolveMain.EXIT_SUCCESS, this.run("idna", "3.4@https://pypi.org/simple/idna/"), this.err());
        assertEquals("idna 3.4 pypi.org", this.out().trim());

        // statistics are needed, but neither the cache nor the (unreachable) service can provide them
        this.out.reset();
        this.env.put(ShyConfiguration.ENV_POPULARITY, "or:last_day=1");
        this.env.put(ShyConfiguration.ENV_STATS_API_URL, "http://127.0.0.1:1/api");
        this.env.put(ShyConfiguration.ENV_STATS_TIMEOUT, "1000");
        int status = this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/", "1.3.1@https://pypi.org/simple/sampleproject/");
        assertEquals(ShyResolveMain.EXIT_SUCCESS, status, this.err());
        assertEquals("sampleproject 1.3.0 pkgs.example.com", this.out().trim());
        assertTrue(Files.isRegularFile(file));
    }

    @Test
    public void testDevelopmentReleaseIsOlder() {
        int status = this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/", "1.3.0.dev1@https://pypi.org/simple/sampleproject/");
        assertEquals(ShyResolveMain.EXIT_SUCCESS, status, this.err());
        assertEquals("sampleproject 1.3.0 pkgs.example.com", this.out().trim());

        this.out.reset();
        this.env.put(ShyConfiguration.ENV_VERSION_SCHEME, "maven");
        assertEquals(ShyResolveMain.EXIT_ABORT, this.run("sampleproject", "1.3.0@https://pkgs.example.com/simple/sampleproject/", "1.3.0.dev1@https://pypi.org/simple/sampleproject/"));
        assertEquals("", this.out());
    }

    @Test
    public void testUntrustedOnly() {
        int status = this.run("idna", "3.3@https://pypi.org/simple/idna/", "3.4@https://pypi.org/simple/idna/");
        assertEquals(ShyResolveMain.EXIT_SUCCESS, status, this.err());
        assertEquals("idna 3.4 pypi.org", this.out().trim());
    }

    @Test
    public void testUsage() {
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run());
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject"));
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject", "1.3.0"));
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject", "@https://pypi.org/simple/"));
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject", "1.3.0@"));
        assertEquals(ShyResolveMain.EXIT_USAGE, this.run("sampleproject", "1.3.0@https://pypi .org/"));
        assertTrue(this.err().contains("Usage: shyresolve"), this.err());
    }
}
