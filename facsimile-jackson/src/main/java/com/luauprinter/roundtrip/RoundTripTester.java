package com.luauprinter.roundtrip;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ParseOptions;
import com.luauprinter.ParseResult;
import com.luauprinter.Parser;
import com.luauprinter.Transpiler;
import com.luauprinter.jackson.LuauJackson;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.stream.*;

/**
 * Checks the printer against a corpus of Luau files.
 *
 * Two modes of operation:
 * 1. Exact mode: parses each file with concrete syntax data and checks that
 *    printing reproduces the file
 * 2. Canonical mode: prints each file without concrete syntax data and checks
 *    that the output reparses and prints to itself
 *
 * Usage:
 *   java -cp ... com.luauprinter.roundtrip.RoundTripTester [options] <source-dirs...>
 *
 * Options:
 *   --mode=exact|canonical  Mode of operation (default: exact)
 *   --types / --no-types    Print type annotations (default: --types)
 *   --threads=N             Number of worker threads (default: available processors)
 *   --max-file-size=N       Max file size in KB to process, 0 = no limit (default: 0)
 *   --output-dir=PATH       Directory for failure reports (default: ./round-trip-output)
 *   --extensions=ext,...    File extensions to process (default: luau,lua)
 *   --verbose               Enable verbose output
 */
public class RoundTripTester {

    private static final ObjectMapper mapper = LuauJackson.createObjectMapper();

    private final Config config;

    // Statistics (thread-safe)
    private final AtomicLong totalFiles = new AtomicLong(0);
    private final AtomicLong processedFiles = new AtomicLong(0);
    private final AtomicLong skippedFiles = new AtomicLong(0);
    private final AtomicLong passedFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);

    private final ConcurrentLinkedQueue<FailureRecord> failures = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<String> skippedReasons = new ConcurrentLinkedQueue<>();

    private final ExecutorService executor;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        RoundTripTester tester = new RoundTripTester(config);
        try {
            int exitCode = tester.run();
            System.exit(exitCode);
        } catch (IOException | InterruptedException e) {
            System.err.println("Fatal error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public RoundTripTester(Config config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.threads);
    }

    /**
     * Processes every file and writes the failure report.
     *
     * @return 0 when every processed file passed, 1 otherwise
     */
    public int run() throws IOException, InterruptedException {
        System.out.println("Facsimile round-trip checker");
        System.out.println();
        System.out.println("Configuration:");
        System.out.println("  Mode:          " + config.mode);
        System.out.println("  Types:         " + (config.withTypes ? "printed" : "dropped"));
        System.out.println("  Threads:       " + config.threads);
        System.out.println("  Max file size: " + (config.maxFileSizeKB > 0 ? config.maxFileSizeKB + " KB" : "no limit"));
        System.out.println("  Output dir:    " + config.outputDir);
        System.out.println("  Extensions:    " + config.extensions);
        System.out.println("  Source dirs:   " + config.sourceDirs);
        System.out.println();

        Files.createDirectories(config.outputDir);

        System.out.println("Discovering files...");
        List<Path> allFiles = discoverFiles();
        totalFiles.set(allFiles.size());
        System.out.println("Found " + totalFiles.get() + " files to process");
        System.out.println();

        long startTime = System.currentTimeMillis();

        List<Future<?>> futures = new ArrayList<>();
        for (Path file : allFiles) {
            futures.add(executor.submit(() -> processFile(file)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // processFile records its own failures; anything reaching here is a bug in the checker
                System.err.println("[ERROR] Unexpected failure: " + e.getCause());
                failedFiles.incrementAndGet();
            }
        }

        executor.shutdown();
        executor.awaitTermination(10, TimeUnit.SECONDS);

        long elapsedMs = System.currentTimeMillis() - startTime;
        printFinalResults(elapsedMs);
        writeFailureReport();
        printAllFailuresToConsole();

        return failedFiles.get() > 0 ? 1 : 0;
    }

    private List<Path> discoverFiles() throws IOException {
        List<Path> files = new ArrayList<>();

        for (Path sourceDir : config.sourceDirs) {
            if (!Files.exists(sourceDir)) {
                System.err.println("Warning: Source directory does not exist: " + sourceDir);
                continue;
            }

            try (Stream<Path> paths = Files.walk(sourceDir)) {
                paths.filter(Files::isRegularFile)
                     .filter(this::hasValidExtension)
                     .sorted()
                     .forEach(files::add);
            }
        }
        return files;
    }

    private boolean hasValidExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return config.extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    void processFile(Path file) {
        try {
            long fileSize = Files.size(file);
            if (config.maxFileSizeKB > 0 && fileSize > config.maxFileSizeKB * 1024L) {
                skippedFiles.incrementAndGet();
                skippedReasons.add(file.toAbsolutePath() + " - Too large (" + (fileSize / 1024) + " KB)");
                if (config.verbose) {
                    System.out.println("[SKIP] Too large: " + file);
                }
                return;
            }

            String source = Files.readString(file);
            FailureRecord failure = check(file, source);
            processedFiles.incrementAndGet();

            if (failure == null) {
                passedFiles.incrementAndGet();
                if (config.verbose) {
                    System.out.println("[OK] " + file);
                }
            } else {
                failedFiles.incrementAndGet();
                failures.add(failure);
                if (config.verbose) {
                    System.out.println("[FAIL] " + failure.type() + ": " + file);
                }
            }
        } catch (IOException e) {
            skippedFiles.incrementAndGet();
            skippedReasons.add(file.toAbsolutePath() + " - IO error: " + e.getMessage());
            if (config.verbose) {
                System.err.println("[ERROR] IO error reading: " + file + " - " + e.getMessage());
            }
        }
    }

    /**
     * Runs the configured check on one source.
     *
     * @return the failure, or null when the file passes
     */
    FailureRecord check(Path file, String source) {
        ParseOptions options = config.mode == Mode.EXACT ? ParseOptions.defaults() : ParseOptions.withoutCst();
        ParseResult parsed = Parser.parse(source, options);
        if (parsed.hasErrors()) {
            return new FailureRecord(file, FailureType.PARSE_FAILURE, parsed.errors().get(0).toString(), null);
        }

        String printed;
        try {
            printed = print(parsed);
        } catch (InternalConsistencyException e) {
            return new FailureRecord(file, FailureType.PRINT_FAILURE, e.getMessage(), null);
        }

        ParseResult reparsed = Parser.parse(printed, ParseOptions.withoutCst());
        if (reparsed.hasErrors()) {
            return new FailureRecord(file, FailureType.REPARSE_FAILURE, reparsed.errors().get(0).toString(),
                printed);
        }

        if (config.mode == Mode.EXACT) {
            // Without types the output legitimately differs wherever the source has annotations
            String expected = normalize(source);
            String actual = normalize(printed);
            if (config.withTypes && !actual.equals(expected)) {
                return new FailureRecord(file, FailureType.MISMATCH, firstDifference(expected, actual), printed);
            }
        } else {
            String reprinted = print(reparsed);
            if (!reprinted.equals(printed)) {
                return new FailureRecord(file, FailureType.NOT_FIXED_POINT, firstDifference(printed, reprinted),
                    reprinted);
            }
        }
        return null;
    }

    private String print(ParseResult parsed) {
        return config.withTypes
            ? Transpiler.transpileWithTypes(parsed.root(), parsed.cstNodeMap())
            : Transpiler.transpile(parsed.root(), parsed.cstNodeMap());
    }

    /**
     * The text as the printer can reproduce it: line endings become
     * {@code \n}, tabs become single spaces, comments are blanked out and
     * trailing whitespace is dropped from every line.
     */
    static String normalize(String text) {
        String blanked = blankComments(text.replace("\r\n", "\n").replace('\t', ' '));
        return blanked.lines()
            .map(String::stripTrailing)
            .collect(Collectors.joining("\n", "", blanked.endsWith("\n") ? "\n" : ""));
    }

    /**
     * Replaces every character of a comment except newlines with a space.
     * String literals are skipped so that {@code --} inside them is kept.
     */
    static String blankComments(String text) {
        StringBuilder out = new StringBuilder(text);
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(text, i);
            } else if (c == '[' && longBracketLevel(text, i) >= 0) {
                i = skipLongBracket(text, i, longBracketLevel(text, i));
            } else if (c == '-' && i + 1 < length && text.charAt(i + 1) == '-') {
                int end;
                int level = i + 2 < length ? longBracketLevel(text, i + 2) : -1;
                if (level >= 0) {
                    end = skipLongBracket(text, i + 2, level);
                } else {
                    int newline = text.indexOf('\n', i);
                    end = newline < 0 ? length : newline;
                }
                for (int k = i; k < end; k++) {
                    if (out.charAt(k) != '\n') {
                        out.setCharAt(k, ' ');
                    }
                }
                i = end;
            } else {
                i++;
            }
        }
        return out.toString();
    }

    private static int skipQuoted(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote || (c == '\n' && quote != '`')) {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }

    /**
     * The number of {@code =} signs of a long bracket opening at
     * {@code start}, or -1 when there is none.
     */
    private static int longBracketLevel(String text, int start) {
        if (text.charAt(start) != '[') {
            return -1;
        }
        int i = start + 1;
        while (i < text.length() && text.charAt(i) == '=') {
            i++;
        }
        return i < text.length() && text.charAt(i) == '[' ? i - start - 1 : -1;
    }

    private static int skipLongBracket(String text, int start, int level) {
        String close = "]" + "=".repeat(level) + "]";
        int end = text.indexOf(close, start + level + 2);
        return end < 0 ? text.length() : end + close.length();
    }

    /**
     * Describes the first line on which two texts differ.
     */
    static String firstDifference(String expected, String actual) {
        String[] expectedLines = expected.split("\n", -1);
        String[] actualLines = actual.split("\n", -1);
        int lines = Math.min(expectedLines.length, actualLines.length);
        for (int i = 0; i < lines; i++) {
            if (!expectedLines[i].equals(actualLines[i])) {
                return "line " + (i + 1) + ": expected " + summarize(expectedLines[i])
                    + ", got " + summarize(actualLines[i]);
            }
        }
        return "expected " + expectedLines.length + " lines, got " + actualLines.length;
    }

    private static String summarize(String line) {
        return line.length() > 80 ? "\"" + line.substring(0, 80) + "...\"" : "\"" + line + "\"";
    }

    private void printFinalResults(long elapsedMs) {
        System.out.println();
        System.out.println("Final results");
        System.out.println();
        System.out.printf("  Total files:              %d%n", totalFiles.get());
        System.out.printf("  Processed:                %d%n", processedFiles.get());
        System.out.printf("  Skipped (size/error):     %d%n", skippedFiles.get());
        System.out.println();
        System.out.printf("  Passed:                   %d%n", passedFiles.get());
        System.out.printf("  Failed:                   %d%n", failedFiles.get());
        System.out.println();
        System.out.printf("  Elapsed time:             %.2f seconds%n", elapsedMs / 1000.0);
        if (elapsedMs > 0) {
            System.out.printf("  Throughput:               %.1f files/sec%n",
                processedFiles.get() * 1000.0 / elapsedMs);
        }
        System.out.println();

        if (failedFiles.get() > 0) {
            System.out.println("  FAILURES DETECTED - see " + config.outputDir + " for details");
        } else {
            System.out.println("  ALL FILES PASSED");
        }

        if (!skippedReasons.isEmpty()) {
            System.out.println();
            System.out.println("  Skipped files:");
            for (String reason : skippedReasons) {
                System.out.println("    - " + reason);
            }
        }
    }

    private void writeFailureReport() throws IOException {
        if (failures.isEmpty()) {
            return;
        }

        Path summaryFile = config.outputDir.resolve("failure-summary.txt");
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(summaryFile))) {
            writer.println("Facsimile round-trip checker - Failure Summary");
            writer.println();
            writer.printf("Total failures: %d%n", failures.size());
            writer.println();

            Map<FailureType, List<FailureRecord>> byType = failures.stream()
                .collect(Collectors.groupingBy(FailureRecord::type, TreeMap::new, Collectors.toList()));

            for (Map.Entry<FailureType, List<FailureRecord>> entry : byType.entrySet()) {
                writer.println(entry.getKey() + ": " + entry.getValue().size());
                for (FailureRecord failure : entry.getValue()) {
                    writer.println("  - " + failure.file());
                    if (failure.message() != null) {
                        writer.println("    " + failure.message());
                    }
                }
                writer.println();
            }
        }
        System.out.println("Wrote failure summary to: " + summaryFile);

        Path jsonFile = config.outputDir.resolve("failures.json");
        List<Map<String, Object>> jsonFailures = new ArrayList<>();
        for (FailureRecord failure : failures) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("file", failure.file().toString());
            map.put("type", failure.type().name());
            map.put("message", failure.message());
            jsonFailures.add(map);
        }
        Files.writeString(jsonFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jsonFailures));
        System.out.println("Wrote JSON failures to: " + jsonFile);

        Path outputsDir = config.outputDir.resolve("outputs");
        int written = 0;
        for (FailureRecord failure : failures) {
            if (failure.output() != null) {
                Files.createDirectories(outputsDir);
                String safeName = failure.file().toString().replaceAll("[^a-zA-Z0-9.-]", "_");
                Files.writeString(outputsDir.resolve(safeName), failure.output());
                written++;
            }
        }
        if (written > 0) {
            System.out.println("Wrote " + written + " printed outputs to: " + outputsDir);
        }
    }

    private void printAllFailuresToConsole() {
        if (failures.isEmpty()) {
            return;
        }

        System.out.println();
        System.out.println("All failures");
        System.out.println();

        int count = 0;
        for (FailureRecord failure : failures) {
            count++;
            System.out.println("[" + count + "] " + failure.type() + ": " + failure.file());
            if (failure.message() != null) {
                System.out.println("    " + failure.message());
            }
        }
        System.out.println();
        System.out.println("Total failures: " + failures.size());
    }

    private static void printUsage() {
        System.out.println("Usage: RoundTripTester [options] <source-dirs...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --mode=exact|canonical  Mode of operation (default: exact)");
        System.out.println("  --types, --no-types     Print type annotations (default: --types)");
        System.out.println("  --threads=N             Number of worker threads (default: CPU count)");
        System.out.println("  --max-file-size=N       Max file size in KB, 0=no limit (default: 0)");
        System.out.println("  --output-dir=PATH       Directory for failure reports (default: ./round-trip-output)");
        System.out.println("  --extensions=ext,...    File extensions to process (default: luau,lua)");
        System.out.println("  --verbose               Enable verbose output");
        System.out.println("  --help                  Show this help");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  RoundTripTester --mode=exact /path/to/luau/files");
        System.out.println("  RoundTripTester --mode=canonical --no-types --threads=8 ./sources");
    }

    // ========== Inner classes ==========

    public enum Mode {
        EXACT, CANONICAL
    }

    public enum FailureType {
        PARSE_FAILURE,
        PRINT_FAILURE,
        REPARSE_FAILURE,
        MISMATCH,
        NOT_FIXED_POINT
    }

    /**
     * @param output the printed text, when there is one worth keeping
     */
    public record FailureRecord(
        Path file,
        FailureType type,
        String message,
        String output
    ) {}

    public static class Config {
        Mode mode = Mode.EXACT;
        boolean withTypes = true;
        int threads = Runtime.getRuntime().availableProcessors();
        int maxFileSizeKB = 0; // 0 = no limit
        Path outputDir = Path.of("round-trip-output");
        List<String> extensions = List.of("luau", "lua");
        List<Path> sourceDirs = new ArrayList<>();
        boolean verbose = false;

        /**
         * @return the configuration, or null after printing the problem when
         *         the arguments are invalid or help was requested
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase();
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.equals("--types")) {
                    config.withTypes = true;
                } else if (arg.equals("--no-types")) {
                    config.withTypes = false;
                } else if (arg.startsWith("--threads=")) {
                    config.threads = parsePositive(arg.substring(10), "--threads");
                    if (config.threads <= 0) {
                        return null;
                    }
                } else if (arg.startsWith("--max-file-size=")) {
                    config.maxFileSizeKB = parsePositive(arg.substring(16), "--max-file-size");
                    if (config.maxFileSizeKB < 0) {
                        return null;
                    }
                } else if (arg.startsWith("--output-dir=")) {
                    config.outputDir = Path.of(arg.substring(13));
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).split(","));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.sourceDirs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.sourceDirs.isEmpty()) {
                System.err.println("Error: No source directories specified");
                return null;
            }

            return config;
        }

        private static int parsePositive(String value, String option) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                System.err.println("Invalid number for " + option + ": " + value);
                return -1;
            }
        }

        public Mode mode() {
            return mode;
        }

        public boolean withTypes() {
            return withTypes;
        }

        public int threads() {
            return threads;
        }

        public List<Path> sourceDirs() {
            return sourceDirs;
        }
    }
}
