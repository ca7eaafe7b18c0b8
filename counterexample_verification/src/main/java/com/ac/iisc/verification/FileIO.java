/*
 * =====================================================================================
 *  FileIO.java
 *
 *  Purpose
 *  -------
 *  Centralizes file input/output and configuration used across the
 *  counterexample_verification module, so that UTF-8 handling, CSV dialect and
 *  config lookup are consistent everywhere (CLI, verifier, evaluator, tests).
 *
 *  What it provides
 *  ----------------
 *  - readTextFile / writeTextFile: UTF-8 text with validation.
 *  - readRecords / writeRecords: header-based CSV tables of prover results
 *    (Apache Commons CSV, RFC 4180 quoting so multi-line counterexample blocks
 *    survive a round trip).
 *  - getProperty and typed accessors: `config.properties` from the classpath,
 *    optionally overridden by a file named in the `verification.config`
 *    system property.
 *
 *  Error handling
 *  --------------
 *  - Null/blank arguments throw IllegalArgumentException.
 *  - Missing or unreadable files throw IOException with the offending path.
 *  - A broken config file is reported on stderr and the defaults are used.
 *
 *  Thread-safety
 *  -------------
 *  - Stateless apart from the lazily loaded config, which is published once
 *    through a volatile field.
 *
 * =====================================================================================
 */
package com.ac.iisc.verification;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

/**
 * Small, focused I/O and configuration utility. All methods are static.
 */
public class FileIO
{
    // Config handling
    private static volatile Properties CONFIG;
    private static final String CONFIG_RESOURCE = "config.properties";
    private static final String CONFIG_OVERRIDE_PROPERTY = "verification.config";

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private FileIO() {
    }

    // --- Text files ---

    /**
     * Read a text file as UTF-8 and return its content.
     *
     * @param path path to the file
     * @return file content
     * @throws IllegalArgumentException if path is null/blank
     * @throws IOException if the file does not exist or cannot be read
     */
    public static String readTextFile(String path) throws IOException {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
        return readTextFile(Paths.get(path));
    }

    public static String readTextFile(Path p) throws IOException {
        if (p == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (!Files.exists(p)) {
            throw new IOException("File not found: " + p);
        }
        return Files.readString(p, StandardCharsets.UTF_8);
    }

    /** Write UTF-8 text content to a file, creating parent directories if needed. */
    public static void writeTextFile(Path p, String content) throws IOException {
        if (p == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        ensureParent(p);
        Files.writeString(p, content == null ? "" : content, StandardCharsets.UTF_8);
    }

    /** Path of a file named {@code fileName} in the same directory as {@code p}. */
    public static Path sibling(Path p, String fileName) {
        Path parent = p.toAbsolutePath().getParent();
        return parent == null ? Paths.get(fileName) : parent.resolve(fileName);
    }

    private static void ensureParent(Path p) throws IOException {
        Path parent = p.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    // --- CSV tables ---

    /**
     * Read a CSV table with a header row into records, keeping column order.
     * Short rows yield empty cells for the missing columns.
     *
     * @throws IOException if the file is missing, unreadable or has no header
     */
    public static List<CounterexampleRecord> readRecords(Path p) throws IOException {
        if (p == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (!Files.exists(p)) {
            throw new IOException("File not found: " + p);
        }
        List<CounterexampleRecord> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(p, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            if (header == null || header.isEmpty()) {
                throw new IOException("CSV has no header row: " + p);
            }
            for (CSVRecord row : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (String column : header) {
                    values.put(column, row.isSet(column) ? row.get(column) : "");
                }
                out.add(new CounterexampleRecord(values));
            }
        } catch (IllegalArgumentException | IllegalStateException ex) {
            // commons-csv reports duplicate/malformed headers and bad quoting this way
            throw new IOException("Malformed CSV " + p + ": " + ex.getMessage(), ex);
        }
        return out;
    }

    /**
     * Write records as a CSV table. The header is the union of the records'
     * columns in first-seen order.
     */
    public static void writeRecords(Path p, List<CounterexampleRecord> records) throws IOException {
        LinkedHashSet<String> header = new LinkedHashSet<>();
        for (CounterexampleRecord r : records) {
            header.addAll(r.columns());
        }
        List<List<String>> rows = new ArrayList<>(records.size());
        for (CounterexampleRecord r : records) {
            List<String> row = new ArrayList<>(header.size());
            for (String column : header) {
                String v = r.get(column);
                row.add(v == null ? "" : v);
            }
            rows.add(row);
        }
        writeTable(p, new ArrayList<>(header), rows);
    }

    /** Write a header plus rows of already-rendered cells. */
    public static void writeTable(Path p, List<String> header, List<? extends List<String>> rows) throws IOException {
        if (p == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        ensureParent(p);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build();
        try (Writer writer = Files.newBufferedWriter(p, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    // --- Config helpers ---

    /** Load config from classpath resource `config.properties`, then apply the optional override file. */
    private static Properties getConfig() {
        if (CONFIG == null) {
            synchronized (FileIO.class) {
                if (CONFIG == null) {
                    Properties props = new Properties();
                    try (InputStream is = FileIO.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
                        if (is != null) {
                            props.load(is);
                        }
                    } catch (IOException ex) {
                        System.err.println("[FileIO] Could not read " + CONFIG_RESOURCE + ": " + ex.getMessage() + "; using defaults.");
                    }
                    String override = System.getProperty(CONFIG_OVERRIDE_PROPERTY);
                    if (override != null && !override.isBlank()) {
                        Path cfgPath = Paths.get(override.trim());
                        try (InputStream fis = Files.newInputStream(cfgPath)) {
                            props.load(fis);
                        } catch (IOException ex) {
                            System.err.println("[FileIO] Could not read config override " + cfgPath + ": " + ex.getMessage());
                        }
                    }
                    CONFIG = props;
                }
            }
        }
        return CONFIG;
    }

    /** Get property by key with a default fallback. */
    public static String getProperty(String key, String defaultValue) {
        String v = getConfig().getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static int getIntProperty(String key, int defaultValue) {
        String v = getProperty(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ex) {
            System.err.println("[FileIO] Warning: property '" + key + "' is not an integer (" + v + "); using " + defaultValue);
            return defaultValue;
        }
    }

    public static boolean getBooleanProperty(String key, boolean defaultValue) {
        String v = getProperty(key, null);
        return v == null ? defaultValue : Boolean.parseBoolean(v);
    }

    // Typed accessors
    public static int getWorkers() { return Math.max(1, getIntProperty("workers", 1)); }
    public static int getCaseTimeoutSeconds() { return Math.max(1, getIntProperty("case_timeout_seconds", 30)); }
    public static int getInlineMaxRows() { return getIntProperty("inline_max_rows", 100); }
    public static int getSampleRows() { return Math.max(0, getIntProperty("sample_rows", 10)); }
    public static boolean isSanitizeQueries() { return getBooleanProperty("sanitize_queries", false); }

    /**
     * Reserved words to quote, as {@code WORD -> continuation keyword}. Read from
     * {@code reserved_words=ORDER:BY,...}; a word without ":" has no continuation
     * and is always quoted.
     */
    public static Map<String, String> getReservedWords() {
        String raw = getProperty("reserved_words", "ORDER:BY");
        Map<String, String> out = new LinkedHashMap<>();
        for (String entry : raw.split(",")) {
            String t = entry.trim();
            if (t.isEmpty()) continue;
            int colon = t.indexOf(':');
            if (colon < 0) {
                out.put(t.toUpperCase(), "");
            } else {
                out.put(t.substring(0, colon).trim().toUpperCase(), t.substring(colon + 1).trim().toUpperCase());
            }
        }
        return out;
    }
}
