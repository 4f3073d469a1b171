package com.astro.calpipe.pending;

import com.astro.calpipe.error.CalPipeException;
import com.astro.calpipe.error.CombinationTimeoutException;
import com.astro.calpipe.error.InsufficientFramesException;
import com.astro.calpipe.error.LedgerLockException;
import com.astro.calpipe.error.MissingMandatoryCalibrationException;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.LightFrame;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.PendingKind;
import com.astro.calpipe.model.PendingState;
import com.astro.calpipe.model.ReducedFrame;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.service.FrameIndexService;
import com.astro.calpipe.service.MasterFrameService;
import com.astro.calpipe.service.ReductionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The periodic ledger pass. Every entry is re-matched and rebuilt (masters) or re-reduced
 * (lights), then classified: resolved and expired entries are dropped, the rest are written
 * back with their new ages. The ledger is rewritten once at the end of the pass.
 *
 * <p>Master entries go first so that lights re-reduced in the same pass see the rebuilt masters.
 */
public class PendingPassService {
    private static final Logger log = LoggerFactory.getLogger(PendingPassService.class);

    private static final Comparator<PendingEntry> PASS_ORDER = Comparator
            .comparingInt((PendingEntry e) -> rank(e.kind))
            .thenComparing(e -> e.nightDir.toString())
            .thenComparing(e -> e.path.toString());

    private final PendingLedger ledger;
    private final FrameIndexService index;
    private final MasterFrameService masters;
    private final ReductionService reduction;
    private final int maxSearchDays;
    private final Clock clock;

    public PendingPassService(PendingLedger ledger, FrameIndexService index, MasterFrameService masters,
                              ReductionService reduction, int maxSearchDays, Clock clock) {
        this.ledger = ledger;
        this.index = index;
        this.masters = masters;
        this.reduction = reduction;
        this.maxSearchDays = maxSearchDays;
        this.clock = clock;
    }

    public RunSummary run() {
        return run(new RunSummary());
    }

    /**
     * Runs one pass. The ledger lock is held only to take the snapshot and, at the end, to merge
     * the outcome into the current ledger, so night runs can log rows while products are rebuilt.
     * Rows added or replaced by another writer during the pass are kept as they are. When the
     * ledger cannot be locked or rewritten the pass is marked failed in the summary and the
     * ledger file is left as it was.
     */
    public RunSummary run(RunSummary summary) {
        LocalDate today = LocalDate.now(clock);
        log.info("Pending pass on {} for {}", ledger.file(), today);
        try {
            List<PendingEntry> ordered = new ArrayList<>(ledger.read().entries());
            ordered.sort(PASS_ORDER);

            // snapshot row -> row to write back, or null to drop it
            Map<PendingEntry, PendingEntry> outcome = new HashMap<>();
            for (PendingEntry entry : ordered) {
                PendingEntry updated = reevaluate(entry, summary);
                PendingState state = updated.classify(today);
                switch (state) {
                    case RESOLVED:
                        log.info("Resolved {}", entry.path);
                        summary.pendingResolved.incrementAndGet();
                        outcome.put(entry, null);
                        break;
                    case EXPIRED:
                        log.info("Expired {} (expired {}), keeping it as final", entry.path, updated.expires);
                        summary.pendingExpired.incrementAndGet();
                        outcome.put(entry, null);
                        break;
                    default:
                        summary.pendingLogged.incrementAndGet();
                        outcome.put(entry, updated);
                }
            }

            ledger.transaction(session -> {
                PendingLedger.Snapshot current = session.read();
                for (PendingLedger.CorruptRow row : current.corrupt()) {
                    summary.fail(RunSummary.ErrorKind.LEDGER_CORRUPTION, ledger.file().getFileName(), row.error());
                }
                session.rewrite(merge(current.entries(), outcome));
                return null;
            });
        } catch (LedgerLockException e) {
            log.error("Pending pass failed: {}", e.getMessage());
            summary.fail(RunSummary.ErrorKind.LEDGER_LOCK, ledger.file(), e);
            summary.markLedgerPassFailed();
        } catch (IOException e) {
            log.error("Pending pass failed, ledger left unchanged: {}", e.getMessage());
            summary.fail(RunSummary.ErrorKind.IO, ledger.file(), e);
            summary.markLedgerPassFailed();
        }
        log.info("Pending pass done: {}", summary);
        return summary;
    }

    /**
     * Applies the pass outcome to the ledger as it is now. A row that still equals its snapshot
     * is replaced by its outcome; any other row was written during the pass and wins.
     */
    static List<PendingEntry> merge(List<PendingEntry> current, Map<PendingEntry, PendingEntry> outcome) {
        List<PendingEntry> merged = new ArrayList<>();
        for (PendingEntry row : current) {
            if (!outcome.containsKey(row)) {
                merged.add(row);
                continue;
            }
            PendingEntry updated = outcome.get(row);
            if (updated != null) merged.add(updated);
        }
        return merged;
    }

    /**
     * Re-runs the product behind an entry. Returns the entry with fresh ages; when the product
     * cannot be processed the old entry is returned so it is retried on the next pass.
     */
    PendingEntry reevaluate(PendingEntry entry, RunSummary summary) {
        // a master farther away than the one in use cannot be better
        Integer known = entry.maxKnownOffset();
        int radius = known != null ? Math.min(known, maxSearchDays) : maxSearchDays;
        try {
            NightDirectory night = entry.night();
            if (entry.kind == PendingKind.LIGHT) {
                LightFrame light = index.light(night, night.rawPathFor(entry.path));
                ReducedFrame reduced = reduction.reduce(night, light, radius);
                summary.lightsReduced.incrementAndGet();
                return PendingEntry.forProduct(PendingKind.LIGHT, reduced.outputPath, night, light.binning,
                        light.filter, light.creation, reduced.ages(), maxSearchDays);
            }
            MasterFrameService.BuildResult result = masters.rebuild(night, entry.path, radius);
            summary.mastersBuilt.incrementAndGet();
            if (result.needsFollowUp()) return result.pending();
            return PendingEntry.forProduct(entry.kind, entry.path, night, entry.binning, entry.filter,
                    entry.created, allZero(entry), maxSearchDays);
        } catch (MissingMandatoryCalibrationException e) {
            log.warn("{} still lacks {}", entry.path.getFileName(), e.missing());
            return e.pendingEntry().orElse(entry);
        } catch (CalPipeException | IOException | IllegalArgumentException e) {
            log.error("Re-evaluation of {} failed: {}", entry.path, e.getMessage());
            summary.fail(kindOf(e), entry.path, e);
            return entry;
        }
    }

    private static Map<FrameType, Integer> allZero(PendingEntry entry) {
        Map<FrameType, Integer> ages = new EnumMap<>(FrameType.class);
        for (FrameType t : entry.kind.calibrationTypes()) ages.put(t, 0);
        return ages;
    }

    private static RunSummary.ErrorKind kindOf(Exception e) {
        if (e instanceof CombinationTimeoutException) return RunSummary.ErrorKind.COMBINATION_TIMEOUT;
        if (e instanceof InsufficientFramesException) return RunSummary.ErrorKind.INSUFFICIENT_FRAMES;
        return RunSummary.ErrorKind.IO;
    }

    private static int rank(PendingKind kind) {
        switch (kind) {
            case MASTER_DARK: return 0;
            case MASTER_FLAT: return 1;
            default: return 2;
        }
    }
}
