package com.astro.calpipe.service;

import com.astro.calpipe.model.CelestialPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Plate solves frames with the ASTAP command line tool. The solution's reference point is read
 * from the {@code .wcs} file ASTAP leaves next to the frame.
 */
public class PlateSolveService {
    private static final Logger log = LoggerFactory.getLogger(PlateSolveService.class);

    private static final String SEARCH_RADIUS_DEG = "30";

    private final String astapPath;
    private final String dbPath;
    private final Duration timeout;

    public PlateSolveService(String astapPath, String dbPath, Duration timeout) {
        this.astapPath = astapPath;
        this.dbPath = dbPath;
        this.timeout = timeout;
    }

    public boolean isConfigured() {
        return astapPath != null && !astapPath.isEmpty() && dbPath != null && !dbPath.isEmpty();
    }

    /**
     * @return the solved reference point, empty when ASTAP ran but found no solution
     * @throws IOException when ASTAP is not configured, cannot be started or exceeds the timeout
     */
    public Optional<CelestialPoint> solve(Path fitsFile) throws IOException {
        if (!isConfigured()) throw new IOException("ASTAP path or star database not configured");

        // ASTAP CLI: -f (file) -r (search radius, degrees) -d (database)
        ProcessBuilder pb = new ProcessBuilder(
                astapPath,
                "-f", fitsFile.toAbsolutePath().toString(),
                "-r", SEARCH_RADIUS_DEG,
                "-d", dbPath);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        Process p = pb.start();
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new IOException("ASTAP did not finish within " + timeout.toSeconds() + "s for " + fitsFile.getFileName());
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while solving " + fitsFile.getFileName(), e);
        }

        String name = fitsFile.getFileName().toString();
        String base = name.contains(".") ? name.substring(0, name.lastIndexOf('.')) : name;
        Path wcsFile = fitsFile.resolveSibling(base + ".wcs");
        Path iniFile = fitsFile.resolveSibling(base + ".ini");

        Optional<CelestialPoint> result = Optional.empty();
        try {
            if (Files.exists(wcsFile)) result = parseWcsFile(wcsFile);
        } finally {
            // ASTAP side files are not pipeline products
            Files.deleteIfExists(wcsFile);
            Files.deleteIfExists(iniFile);
        }
        if (result.isEmpty()) log.warn("ASTAP found no solution for {} (exit code {})", name, p.exitValue());
        return result;
    }

    Optional<CelestialPoint> parseWcsFile(Path wcs) throws IOException {
        Double ra = null, dec = null;
        List<String> lines = Files.readAllLines(wcs);
        for (String l : lines) {
            if (l.startsWith("CRVAL1")) ra = cardValue(l);
            if (l.startsWith("CRVAL2")) dec = cardValue(l);
        }
        if (ra != null && dec != null) return Optional.of(new CelestialPoint(ra, dec));
        return Optional.empty();
    }

    private static Double cardValue(String line) {
        String[] parts = line.split("=", 2);
        if (parts.length < 2) return null;
        try {
            return Double.parseDouble(parts[1].split("/")[0].trim());
        } catch (NumberFormatException e) {
            log.warn("Malformed WCS card: {}", line.trim());
            return null;
        }
    }
}
