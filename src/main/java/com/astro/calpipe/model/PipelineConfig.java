package com.astro.calpipe.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;

/**
 * Pipeline settings, read from a TOML file. Every key has a default so an empty file is valid.
 */
public class PipelineConfig {

    public static final String DEFAULT_FILE = "calpipe.toml";

    // [paths]
    private static final String KEY_DATA_ROOT = "paths.data_root";
    private static final String KEY_TELESCOPE_ROOT = "paths.telescope_root";
    private static final String KEY_PENDING_LOG = "paths.pending_log";
    // [clustering]
    private static final String KEY_GAP_HOURS = "clustering.gap_hours";
    private static final String KEY_MIN_FRAMES = "clustering.min_frames";
    // [matching]
    private static final String KEY_MAX_SEARCH_DAYS = "matching.max_search_days";
    // [masters]
    private static final String KEY_COMBINE = "masters.combine";
    private static final String KEY_SIGMA = "masters.sigma";
    private static final String KEY_THREADS = "masters.threads";
    private static final String KEY_BUILD_TIMEOUT = "masters.build_timeout";
    // [reduction]
    private static final String KEY_USE_DARK = "reduction.use_dark";
    private static final String KEY_USE_FLAT = "reduction.use_flat";
    private static final String KEY_ALLOW_PARTIAL = "reduction.allow_partial";
    private static final String KEY_SKIP_REDUCED = "reduction.skip_reduced";
    // [ledger]
    private static final String KEY_LOCK_RETRIES = "ledger.lock_retries";
    private static final String KEY_LOCK_BACKOFF = "ledger.lock_backoff";
    // [pipeline]
    private static final String KEY_STEPS = "pipeline.steps";
    // [astrometry]
    private static final String KEY_ASTAP_PATH = "astrometry.astap_path";
    private static final String KEY_ASTAP_DB = "astrometry.astap_db";
    private static final String KEY_ASTROMETRY_TIMEOUT = "astrometry.timeout";

    private Path dataRoot;
    private Path telescopeRoot;
    private Path pendingLog;
    private double gapHours = 1.0;
    private int minFrames = 1;
    private int maxSearchDays = 365;
    private String combine = "median";
    private double sigma = 3.0;
    private int threads = 4;
    private Duration buildTimeout = Duration.ofMinutes(10);
    private boolean useDark = true;
    private boolean useFlat = true;
    private boolean allowPartial = true;
    private boolean skipReduced = false;
    private int lockRetries = 5;
    private Duration lockBackoff = Duration.ofMillis(200);
    private List<String> steps = List.of("backup", "correction", "reduction");
    private String astapPath = "";
    private String astapDbPath = "";
    private Duration astrometryTimeout = Duration.ofSeconds(15);

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    public static PipelineConfig load(Path file) throws IOException {
        return from(Toml.parse(file), file.toString());
    }

    /** Uses {@code file} if given, else {@value #DEFAULT_FILE} when present, else the defaults. */
    public static PipelineConfig loadOrDefaults(Path file) throws IOException {
        if (file != null) return load(file);
        Path local = Paths.get(DEFAULT_FILE);
        return Files.isRegularFile(local) ? load(local) : defaults();
    }

    public static PipelineConfig parse(String toml) {
        return from(Toml.parse(toml), "<inline>");
    }

    private static PipelineConfig from(TomlParseResult toml, String source) {
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + source + ": " + errors);
        }
        PipelineConfig c = new PipelineConfig();
        c.dataRoot = path(toml, KEY_DATA_ROOT, c.dataRoot);
        c.telescopeRoot = path(toml, KEY_TELESCOPE_ROOT, c.telescopeRoot);
        c.pendingLog = path(toml, KEY_PENDING_LOG, c.pendingLog);
        c.gapHours = number(toml, KEY_GAP_HOURS, c.gapHours);
        c.minFrames = (int) number(toml, KEY_MIN_FRAMES, c.minFrames);
        c.maxSearchDays = (int) number(toml, KEY_MAX_SEARCH_DAYS, c.maxSearchDays);
        c.combine = string(toml, KEY_COMBINE, c.combine);
        c.sigma = number(toml, KEY_SIGMA, c.sigma);
        c.threads = (int) number(toml, KEY_THREADS, c.threads);
        c.buildTimeout = duration(toml, KEY_BUILD_TIMEOUT, c.buildTimeout);
        c.useDark = bool(toml, KEY_USE_DARK, c.useDark);
        c.useFlat = bool(toml, KEY_USE_FLAT, c.useFlat);
        c.allowPartial = bool(toml, KEY_ALLOW_PARTIAL, c.allowPartial);
        c.skipReduced = bool(toml, KEY_SKIP_REDUCED, c.skipReduced);
        c.lockRetries = (int) number(toml, KEY_LOCK_RETRIES, c.lockRetries);
        c.lockBackoff = duration(toml, KEY_LOCK_BACKOFF, c.lockBackoff);
        c.steps = stringList(toml, KEY_STEPS, c.steps);
        c.astapPath = string(toml, KEY_ASTAP_PATH, c.astapPath);
        c.astapDbPath = string(toml, KEY_ASTAP_DB, c.astapDbPath);
        c.astrometryTimeout = duration(toml, KEY_ASTROMETRY_TIMEOUT, c.astrometryTimeout);
        c.validate();
        return c;
    }

    private void validate() {
        if (gapHours <= 0) throw new IllegalArgumentException(KEY_GAP_HOURS + " must be positive");
        if (minFrames < 1) throw new IllegalArgumentException(KEY_MIN_FRAMES + " must be at least 1");
        if (maxSearchDays < 0) throw new IllegalArgumentException(KEY_MAX_SEARCH_DAYS + " must not be negative");
        if (!(sigma > 0)) throw new IllegalArgumentException(KEY_SIGMA + " must be positive");
        if (threads < 1) throw new IllegalArgumentException(KEY_THREADS + " must be at least 1");
        if (lockRetries < 0) throw new IllegalArgumentException(KEY_LOCK_RETRIES + " must not be negative");
    }

    // --- TOML helpers ---

    private static String string(TomlParseResult toml, String key, String def) {
        Object v = toml.get(key);
        if (v == null) return def;
        if (!(v instanceof String s)) throw new IllegalArgumentException(key + " must be a string");
        return s;
    }

    private static Path path(TomlParseResult toml, String key, Path def) {
        String v = string(toml, key, null);
        return v == null || v.isBlank() ? def : Paths.get(v);
    }

    private static double number(TomlParseResult toml, String key, double def) {
        Object v = toml.get(key);
        if (v == null) return def;
        if (!(v instanceof Number n)) throw new IllegalArgumentException(key + " must be a number");
        return n.doubleValue();
    }

    private static boolean bool(TomlParseResult toml, String key, boolean def) {
        Object v = toml.get(key);
        if (v == null) return def;
        if (!(v instanceof Boolean b)) throw new IllegalArgumentException(key + " must be true or false");
        return b;
    }

    private static Duration duration(TomlParseResult toml, String key, Duration def) {
        Object v = toml.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return Duration.ofMillis(n.longValue());
        try {
            return parseDuration(v.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a duration: " + v, e);
        }
    }

    private static List<String> stringList(TomlParseResult toml, String key, List<String> def) {
        Object v = toml.get(key);
        if (v == null) return def;
        if (!(v instanceof TomlArray array)) throw new IllegalArgumentException(key + " must be an array");
        List<String> out = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) out.add(array.getString(i));
        return List.copyOf(out);
    }

    /** Parses {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h}, {@code 3d}; a bare number is milliseconds. */
    public static Duration parseDuration(String raw) {
        String t = raw.trim().toLowerCase(Locale.ROOT);
        if (t.endsWith("ms")) return Duration.ofMillis(Long.parseLong(t.substring(0, t.length() - 2).trim()));
        long value;
        switch (t.isEmpty() ? ' ' : t.charAt(t.length() - 1)) {
            case 's': value = Long.parseLong(t.substring(0, t.length() - 1).trim()); return Duration.ofSeconds(value);
            case 'm': value = Long.parseLong(t.substring(0, t.length() - 1).trim()); return Duration.ofMinutes(value);
            case 'h': value = Long.parseLong(t.substring(0, t.length() - 1).trim()); return Duration.ofHours(value);
            case 'd': value = Long.parseLong(t.substring(0, t.length() - 1).trim()); return Duration.ofDays(value);
            default: return Duration.ofMillis(Long.parseLong(t));
        }
    }

    // --- derived ---

    /** Calibration types a light frame asks for: bias always, dark and flat when enabled. */
    public Set<FrameType> calibrationTypes() {
        EnumSet<FrameType> types = EnumSet.of(FrameType.BIAS);
        if (useDark) types.add(FrameType.DARK);
        if (useFlat) types.add(FrameType.FLAT);
        return types;
    }

    public Duration gap() {
        return Duration.ofSeconds(Math.round(gapHours * 3600));
    }

    // --- GETTERS & SETTERS ---

    public Path getDataRoot() { return dataRoot; }
    public void setDataRoot(Path v) { dataRoot = v; }

    public Path getTelescopeRoot() { return telescopeRoot; }
    public void setTelescopeRoot(Path v) { telescopeRoot = v; }

    /** Explicit ledger path, else {@code pending_log.csv} under the data root (or the working directory). */
    public Path getPendingLog() {
        if (pendingLog != null) return pendingLog;
        Path root = dataRoot != null ? dataRoot : Paths.get(".");
        return root.resolve("pending_log.csv");
    }
    public void setPendingLog(Path v) { pendingLog = v; }

    /** True when the ledger location comes from configuration rather than the working directory. */
    public boolean hasLedgerLocation() {
        return pendingLog != null || dataRoot != null;
    }

    public double getGapHours() { return gapHours; }
    public void setGapHours(double v) { gapHours = v; }

    public int getMinFrames() { return minFrames; }
    public void setMinFrames(int v) { minFrames = v; }

    public int getMaxSearchDays() { return maxSearchDays; }
    public void setMaxSearchDays(int v) { maxSearchDays = v; }

    public String getCombine() { return combine; }
    public void setCombine(String v) { combine = v; }

    public double getSigma() { return sigma; }
    public void setSigma(double v) { sigma = v; }

    public int getThreads() { return threads; }
    public void setThreads(int v) { threads = v; }

    public Duration getBuildTimeout() { return buildTimeout; }
    public void setBuildTimeout(Duration v) { buildTimeout = v; }

    public boolean isUseDark() { return useDark; }
    public void setUseDark(boolean v) { useDark = v; }

    public boolean isUseFlat() { return useFlat; }
    public void setUseFlat(boolean v) { useFlat = v; }

    public boolean isAllowPartial() { return allowPartial; }
    public void setAllowPartial(boolean v) { allowPartial = v; }

    public boolean isSkipReduced() { return skipReduced; }
    public void setSkipReduced(boolean v) { skipReduced = v; }

    public int getLockRetries() { return lockRetries; }
    public void setLockRetries(int v) { lockRetries = v; }

    public Duration getLockBackoff() { return lockBackoff; }
    public void setLockBackoff(Duration v) { lockBackoff = v; }

    public List<String> getSteps() { return steps; }
    public void setSteps(List<String> v) { steps = List.copyOf(v); }

    public String getAstapPath() { return astapPath; }
    public void setAstapPath(String v) { astapPath = v; }

    public String getAstapDbPath() { return astapDbPath; }
    public void setAstapDbPath(String v) { astapDbPath = v; }

    public Duration getAstrometryTimeout() { return astrometryTimeout; }
    public void setAstrometryTimeout(Duration v) { astrometryTimeout = v; }
}
