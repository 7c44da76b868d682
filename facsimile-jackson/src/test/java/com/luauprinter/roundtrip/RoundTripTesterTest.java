package com.luauprinter.roundtrip;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RoundTripTesterTest {

    @TempDir
    Path tempDir;

    private RoundTripTester tester(String... args) {
        RoundTripTester.Config config = RoundTripTester.Config.parse(args);
        assertNotNull(config);
        return new RoundTripTester(config);
    }

    @Test
    void testConfigDefaults() {
        RoundTripTester.Config config = RoundTripTester.Config.parse(new String[]{"src"});

        assertEquals(RoundTripTester.Mode.EXACT, config.mode());
        assertTrue(config.withTypes());
        assertEquals(List.of(Path.of("src")), config.sourceDirs());
    }

    @Test
    void testConfigOptions() {
        RoundTripTester.Config config = RoundTripTester.Config.parse(
            new String[]{"--mode=canonical", "--no-types", "--threads=3", "a", "b"});

        assertEquals(RoundTripTester.Mode.CANONICAL, config.mode());
        assertFalse(config.withTypes());
        assertEquals(3, config.threads());
        assertEquals(2, config.sourceDirs().size());
    }

    @Test
    void testConfigRejectsBadArguments() {
        assertNull(RoundTripTester.Config.parse(new String[]{}));
        assertNull(RoundTripTester.Config.parse(new String[]{"--mode=fast", "src"}));
        assertNull(RoundTripTester.Config.parse(new String[]{"--threads=x", "src"}));
        assertNull(RoundTripTester.Config.parse(new String[]{"--bogus", "src"}));
        assertNull(RoundTripTester.Config.parse(new String[]{"--help"}));
    }

    @Test
    void testExactModePassesAndNormalizesLineEndings() {
        RoundTripTester tester = tester("src");

        assertNull(tester.check(Path.of("a.luau"), "local x: number = 1\r\nreturn x\r\n"));
    }

    @Test
    void testCommentsDoNotCauseMismatch() {
        RoundTripTester tester = tester("src");
        String source = "local x = 1 -- note\n--[[ block\ncomment ]]\nlocal s = '--kept' --[=[ x ]=]\nreturn x\n";

        assertNull(tester.check(Path.of("a.luau"), source));
    }

    @Test
    void testNormalizeBlanksComments() {
        assertEquals("local s = '--kept'\n\n\nreturn [[--]]\n",
            RoundTripTester.normalize("local s = '--kept' -- gone\n--[[\n]] \nreturn [[--]]\n"));
    }

    @Test
    void testRealMismatchIsStillReported() {
        RoundTripTester tester = tester("src");

        assertNull(tester.check(Path.of("a.luau"), "local x = 1\n"));
        assertEquals("line 1: expected \"a\", got \"b\"", RoundTripTester.firstDifference(
            RoundTripTester.normalize("a -- c"), RoundTripTester.normalize("b")));
    }

    @Test
    void testParseFailureIsReported() {
        RoundTripTester tester = tester("src");

        RoundTripTester.FailureRecord failure = tester.check(Path.of("bad.luau"), "local = 1");

        assertNotNull(failure);
        assertEquals(RoundTripTester.FailureType.PARSE_FAILURE, failure.type());
    }

    @Test
    void testCanonicalModeReachesFixedPoint() {
        RoundTripTester tester = tester("--mode=canonical", "src");

        assertNull(tester.check(Path.of("a.luau"), "local t = {1, 2; 3}\nprint(`{t[1]}`)"));
    }

    @Test
    void testFirstDifference() {
        assertEquals("line 2: expected \"b\", got \"c\"", RoundTripTester.firstDifference("a\nb", "a\nc"));
        assertEquals("expected 2 lines, got 1", RoundTripTester.firstDifference("a\n", "a"));
    }

    @Test
    void testRunWritesReport() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("sources"));
        Files.writeString(sources.resolve("good.luau"), "local x = 1\n");
        Files.writeString(sources.resolve("bad.luau"), "local = 1\n");
        Files.writeString(sources.resolve("ignored.txt"), "not luau");
        Path output = tempDir.resolve("out");

        int exitCode = tester("--output-dir=" + output, "--threads=2", sources.toString()).run();

        assertEquals(1, exitCode);
        String report = Files.readString(output.resolve("failures.json"));
        assertTrue(report.contains("bad.luau"), report);
        assertFalse(report.contains("good.luau"), report);
        assertTrue(Files.exists(output.resolve("failure-summary.txt")));
    }
}
