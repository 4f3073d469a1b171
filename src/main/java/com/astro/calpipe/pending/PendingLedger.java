package com.astro.calpipe.pending;

import com.astro.calpipe.error.LedgerCorruptionException;
import com.astro.calpipe.error.LedgerLockException;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.PendingKind;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The pending ledger: a CSV file with one row per product awaiting better calibration.
 *
 * <p>Every access holds two locks for the whole read-then-write cycle: an in-process lock per
 * ledger path and an advisory file lock on {@code <ledger>.lock} for other processes. Writes go
 * to a temp file that then replaces the ledger, so readers see either the old or the new file.
 */
public class PendingLedger {
    private static final Logger log = LoggerFactory.getLogger(PendingLedger.class);

    public static final String[] HEADER = {
            "Kind", "Binning", "Filter", "Created", "BIAS-AGE", "DARK-AGE", "FLAT-AGE", "Expires", "Night", "Path"};

    static final String UNRESOLVED = "?";
    static final String NOT_APPLICABLE = "-";

    private static final int COL_KIND = 0, COL_BINNING = 1, COL_FILTER = 2, COL_CREATED = 3,
            COL_BIAS = 4, COL_DARK = 5, COL_FLAT = 6, COL_EXPIRES = 7, COL_NIGHT = 8, COL_PATH = 9;

    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    /** A malformed row, kept verbatim so an upsert can write it back untouched. */
    public record CorruptRow(String[] cells, LedgerCorruptionException error) {
        public String path() {
            return cells.length > COL_PATH ? cells[COL_PATH] : null;
        }
    }

    /** Parsed ledger content. */
    public record Snapshot(List<PendingEntry> entries, List<CorruptRow> corrupt) {
    }


    /** Work done while holding the ledger locks. */
    @FunctionalInterface
    public interface Transaction<T> {
        T run(Session session) throws IOException;
    }

    /** Read and write access, only valid inside a {@link Transaction}. */
    public interface Session {
        Snapshot read() throws IOException;

        void rewrite(Collection<PendingEntry> entries) throws IOException;
    }

    private final Path file;
    private final int lockRetries;
    private final Duration lockBackoff;

    public PendingLedger(Path file, int lockRetries, Duration lockBackoff) {
        this.file = file.toAbsolutePath().normalize();
        this.lockRetries = lockRetries;
        this.lockBackoff = lockBackoff;
    }

    public Path file() {
        return file;
    }

    public Snapshot read() throws IOException, LedgerLockException {
        return transaction(Session::read);
    }

    public void upsert(PendingEntry entry) throws IOException, LedgerLockException {
        upsert(List.of(entry));
    }

    /**
     * Adds or replaces rows keyed by path. Other rows, malformed ones included, stay as they are.
     */
    public void upsert(Collection<PendingEntry> entries) throws IOException, LedgerLockException {
        if (entries.isEmpty()) return;
        transaction(session -> {
            List<String[]> rows = new ArrayList<>();
            Map<String, PendingEntry> incoming = new LinkedHashMap<>();
            for (PendingEntry e : entries) incoming.put(e.path.toString(), e);

            for (String[] cells : readRows()) {
                String path = cells.length > COL_PATH ? cells[COL_PATH] : null;
                PendingEntry replacement = path == null ? null : incoming.remove(path);
                rows.add(replacement != null ? toRow(replacement) : cells);
            }
            for (PendingEntry e : incoming.values()) rows.add(toRow(e));
            writeRows(rows);
            log.info("Ledger {}: upserted {} entries", file.getFileName(), entries.size());
            return null;
        });
    }

    /** Runs {@code tx} holding both locks, retrying lock acquisition with exponential backoff. */
    public <T> T transaction(Transaction<T> tx) throws IOException, LedgerLockException {
        ReentrantLock local = LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        Path lockFile = file.resolveSibling(file.getFileName() + ".lock");
        Files.createDirectories(file.getParent());

        for (int attempt = 0; ; attempt++) {
            boolean last = attempt >= lockRetries;
            long wait = lockBackoff.toMillis() << Math.min(attempt, 20);
            try {
                if (local.tryLock(last ? 0 : wait, TimeUnit.MILLISECONDS)) {
                    try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                        FileLock lock = tryFileLock(channel);
                        if (lock != null) {
                            try {
                                return tx.run(new FileSession());
                            } finally {
                                lock.release();
                            }
                        }
                    } finally {
                        local.unlock();
                    }
                    if (last) break;
                    log.debug("Ledger {} locked by another process, retrying in {} ms", file.getFileName(), wait);
                    Thread.sleep(wait);
                } else if (last) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LedgerLockException("Interrupted while waiting for ledger lock " + lockFile, e);
            }
        }
        throw new LedgerLockException("Could not lock ledger " + file + " after " + (lockRetries + 1) + " attempts");
    }

    private static FileLock tryFileLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    private final class FileSession implements Session {
        @Override
        public Snapshot read() throws IOException {
            List<PendingEntry> entries = new ArrayList<>();
            List<CorruptRow> corrupt = new ArrayList<>();
            long line = 1;
            for (String[] cells : readRows()) {
                line++;
                try {
                    entries.add(parse(cells, line));
                } catch (LedgerCorruptionException e) {
                    log.warn("Ledger {}: {}", file.getFileName(), e.getMessage());
                    corrupt.add(new CorruptRow(cells, e));
                }
            }
            return new Snapshot(entries, corrupt);
        }

        @Override
        public void rewrite(Collection<PendingEntry> entries) throws IOException {
            List<String[]> rows = new ArrayList<>();
            for (PendingEntry e : entries) rows.add(toRow(e));
            writeRows(rows);
        }
    }

    // --- CSV ---

    private List<String[]> readRows() throws IOException {
        if (!Files.exists(file)) return List.of();
        List<String[]> rows = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8); CSVReader csv = new CSVReader(r)) {
            String[] cells;
            boolean first = true;
            while ((cells = csv.readNext()) != null) {
                if (first) {
                    first = false;
                    if (Arrays.equals(cells, HEADER)) continue;
                }
                if (cells.length == 1 && cells[0].isBlank()) continue;
                rows.add(cells);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Unreadable ledger " + file + ": " + e.getMessage(), e);
        }
        return rows;
    }

    private void writeRows(List<String[]> rows) throws IOException {
        Path tmp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8); CSVWriter csv = new CSVWriter(w)) {
                csv.writeNext(HEADER, false);
                for (String[] row : rows) csv.writeNext(row, false);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static String[] toRow(PendingEntry e) {
        String[] row = new String[HEADER.length];
        row[COL_KIND] = e.kind.name();
        row[COL_BINNING] = e.binning == null ? "" : e.binning;
        row[COL_FILTER] = e.filter == null ? "" : e.filter;
        row[COL_CREATED] = e.created == null ? "" : e.created.toString();
        row[COL_BIAS] = ageCell(e, FrameType.BIAS);
        row[COL_DARK] = ageCell(e, FrameType.DARK);
        row[COL_FLAT] = ageCell(e, FrameType.FLAT);
        row[COL_EXPIRES] = e.expires.toString();
        row[COL_NIGHT] = e.nightDir.toString();
        row[COL_PATH] = e.path.toString();
        return row;
    }

    private static String ageCell(PendingEntry e, FrameType type) {
        if (!e.isApplicable(type)) return NOT_APPLICABLE;
        Integer age = e.age(type);
        return age == null ? UNRESOLVED : Integer.toString(age);
    }

    static PendingEntry parse(String[] cells, long line) throws LedgerCorruptionException {
        if (cells.length != HEADER.length) {
            throw new LedgerCorruptionException(line, "expected " + HEADER.length + " columns, found " + cells.length);
        }
        PendingKind kind;
        try {
            kind = PendingKind.valueOf(cells[COL_KIND].trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerCorruptionException(line, "unknown kind '" + cells[COL_KIND] + "'", e);
        }
        Map<FrameType, Integer> ages = new EnumMap<>(FrameType.class);
        ageCell(cells[COL_BIAS], FrameType.BIAS, kind, ages, line);
        ageCell(cells[COL_DARK], FrameType.DARK, kind, ages, line);
        ageCell(cells[COL_FLAT], FrameType.FLAT, kind, ages, line);

        String path = cells[COL_PATH].trim();
        String night = cells[COL_NIGHT].trim();
        if (path.isEmpty() || night.isEmpty()) throw new LedgerCorruptionException(line, "missing path or night");
        try {
            LocalDateTime created = cells[COL_CREATED].isBlank() ? null : LocalDateTime.parse(cells[COL_CREATED].trim());
            LocalDate expires = LocalDate.parse(cells[COL_EXPIRES].trim());
            return new PendingEntry(kind, Path.of(path), Path.of(night), blankToNull(cells[COL_BINNING]),
                    blankToNull(cells[COL_FILTER]), created, expires, ages);
        } catch (DateTimeParseException e) {
            throw new LedgerCorruptionException(line, "bad date '" + e.getParsedString() + "'", e);
        } catch (IllegalArgumentException e) {
            throw new LedgerCorruptionException(line, e.getMessage(), e);
        }
    }

    private static void ageCell(String cell, FrameType type, PendingKind kind, Map<FrameType, Integer> ages, long line)
            throws LedgerCorruptionException {
        String v = cell.trim();
        // "-" also marks a type switched off in the configuration
        if (v.equals(NOT_APPLICABLE)) return;
        if (!kind.calibrationTypes().contains(type)) throw new LedgerCorruptionException(line, type.label() + " age given for " + kind);
        if (v.equals(UNRESOLVED)) {
            ages.put(type, null);
            return;
        }
        try {
            ages.put(type, Integer.parseInt(v));
        } catch (NumberFormatException e) {
            throw new LedgerCorruptionException(line, "bad " + type.label() + " age '" + cell + "'", e);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
