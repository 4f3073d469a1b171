package com.astro.calpipe.service;

import com.astro.calpipe.error.CalPipeException;
import com.astro.calpipe.error.CombinationTimeoutException;
import com.astro.calpipe.error.InsufficientFramesException;
import com.astro.calpipe.error.MissingMandatoryCalibrationException;
import com.astro.calpipe.model.CalibrationMatch;
import com.astro.calpipe.model.CalibrationTarget;
import com.astro.calpipe.model.ClusterKey;
import com.astro.calpipe.model.FrameCluster;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.MasterFrame;
import com.astro.calpipe.model.MasterFrameName;
import com.astro.calpipe.model.MatchResult;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.PendingKind;
import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.model.RawFrame;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.service.combine.CombineStrategy;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds master frames from clusters. Builds for different keys run in parallel on a fixed
 * pool; a build for a given output path is submitted at most once per service instance and
 * every caller asking for it waits on the same future.
 *
 * <p>Within a night bias masters are built first, then darks, then flats, because darks are
 * bias-subtracted and flats are bias- and dark-subtracted.
 */
public class MasterFrameService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MasterFrameService.class);

    // stands in for zero in the combined flat so reduced frames never divide by zero
    static final float FLAT_FLOOR = 1e-30f;

    private static final List<FrameType> BUILD_ORDER = List.of(FrameType.BIAS, FrameType.DARK, FrameType.FLAT);

    /** A written master plus the ledger row it needs when it used masters from other nights. */
    public record BuildResult(MasterFrame master, PendingEntry pending) {
        public boolean needsFollowUp() {
            return pending != null;
        }
    }

    private final PipelineConfig config;
    private final FitsImageService images;
    private final FrameIndexService index;
    private final FrameMatcherService matcher;
    private final CombineStrategy strategy;
    private final ClusterService clusterer;
    private final ExecutorService executor;
    private final Map<Path, Future<BuildResult>> builds = new ConcurrentHashMap<>();

    public MasterFrameService(PipelineConfig config, FitsImageService images, FrameIndexService index,
                              FrameMatcherService matcher, CombineStrategy strategy) {
        this.config = config;
        this.images = images;
        this.index = index;
        this.matcher = matcher;
        this.strategy = strategy;
        this.clusterer = new ClusterService(config.gap(), config.getMinFrames());
        this.executor = Executors.newFixedThreadPool(config.getThreads(), new BuildThreadFactory());
    }

    /**
     * Builds every cluster of a night, phase by phase. Per-cluster failures are recorded in the
     * summary and do not stop the other builds.
     *
     * @param pending receives ledger rows for masters built with (or lacking) other nights' masters
     */
    public List<MasterFrame> buildNight(NightDirectory night, Map<ClusterKey, List<FrameCluster>> clusters,
                                        RunSummary summary, List<PendingEntry> pending) {
        List<MasterFrame> built = new ArrayList<>();
        for (FrameType phase : BUILD_ORDER) {
            Map<FrameCluster, Future<BuildResult>> running = new LinkedHashMap<>();
            clusters.forEach((key, list) -> {
                if (key.type() != phase) return;
                for (FrameCluster c : list) running.put(c, submit(night, c));
            });
            for (Map.Entry<FrameCluster, Future<BuildResult>> e : running.entrySet()) {
                FrameCluster cluster = e.getKey();
                String subject = night.name() + "/" + MasterFrameName.of(cluster).fileName();
                try {
                    BuildResult result = await(e.getValue(), subject);
                    built.add(result.master());
                    summary.mastersBuilt.incrementAndGet();
                    if (result.needsFollowUp()) pending.add(result.pending());
                } catch (MissingMandatoryCalibrationException ex) {
                    log.error("Master {} not built: {}", subject, ex.getMessage());
                    summary.fail(RunSummary.ErrorKind.MISSING_MANDATORY_CALIBRATION, subject, ex);
                    ex.pendingEntry().ifPresent(pending::add);
                } catch (InsufficientFramesException ex) {
                    log.error("Master {} not built: {}", subject, ex.getMessage());
                    summary.fail(RunSummary.ErrorKind.INSUFFICIENT_FRAMES, subject, ex);
                } catch (CombinationTimeoutException ex) {
                    log.error("Master {} not built: {}", subject, ex.getMessage());
                    summary.fail(RunSummary.ErrorKind.COMBINATION_TIMEOUT, subject, ex);
                } catch (CalPipeException | IOException ex) {
                    log.error("Master {} not built: {}", subject, ex.getMessage());
                    summary.fail(RunSummary.ErrorKind.IO, subject, ex);
                }
            }
            matcher.forget(night);
        }
        return built;
    }

    /** Starts (or joins) the build of one cluster. */
    public Future<BuildResult> submit(NightDirectory night, FrameCluster cluster) {
        return submit(night, cluster, matcher.maxSearchDays());
    }

    private Future<BuildResult> submit(NightDirectory night, FrameCluster cluster, int radius) {
        Path target = night.correctionDir().resolve(MasterFrameName.of(cluster).fileName());
        return builds.computeIfAbsent(target, p -> executor.submit(() -> build(night, cluster, radius)));
    }

    /** Waits for a build within the configured budget, cancelling it when the budget runs out. */
    public BuildResult await(Future<BuildResult> future, String subject) throws CalPipeException, IOException {
        Duration budget = config.getBuildTimeout();
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CombinationTimeoutException(subject, budget);
        } catch (CancellationException e) {
            throw new CombinationTimeoutException(subject, budget);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new InterruptedIOException("Interrupted while waiting for " + subject);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CalPipeException) throw (CalPipeException) cause;
            if (cause instanceof IOException) throw (IOException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IOException("Build of " + subject + " failed", cause);
        }
    }

    /**
     * Rebuilds a master, letting the matcher look for better bias/dark masters within
     * {@code radius} days. An existing master is rebuilt from the sources recorded in its header;
     * one that was never written (its bias was missing) is rebuilt from the night's raw frames.
     */
    public BuildResult rebuild(NightDirectory night, Path masterPath, int radius) throws CalPipeException, IOException {
        FrameCluster cluster = Files.exists(masterPath)
                ? fromProvenance(night, masterPath)
                : fromRawFrames(night, masterPath);

        // a rebuild replaces whatever an earlier build of this run produced
        Path target = night.correctionDir().resolve(MasterFrameName.of(cluster).fileName());
        builds.remove(target);
        BuildResult result = await(submit(night, cluster, radius), night.name() + "/" + target.getFileName());
        matcher.forget(night);
        return result;
    }

    private FrameCluster fromProvenance(NightDirectory night, Path masterPath) throws CalPipeException, IOException {
        MasterFrame existing = index.master(night, masterPath);
        if (existing.sourcePaths.isEmpty()) {
            throw new InsufficientFramesException("No source frames recorded in " + masterPath);
        }
        List<RawFrame> members = new ArrayList<>();
        for (Path source : existing.sourcePaths) members.add(index.rawFrame(source));
        return new FrameCluster(existing.key(), existing.clusterIndex, existing.creationTime, members);
    }

    private FrameCluster fromRawFrames(NightDirectory night, Path masterPath) throws CalPipeException, IOException {
        MasterFrameName wanted = MasterFrameName.parse(masterPath.getFileName().toString());
        if (wanted == null) throw new IOException("Not a master frame name: " + masterPath.getFileName());
        List<RawFrame> frames = index.index(night).framesOf(wanted.type());
        for (List<FrameCluster> list : clusterer.clusterAll(frames).values()) {
            for (FrameCluster c : list) {
                if (MasterFrameName.of(c).equals(wanted)) return c;
            }
        }
        throw new InsufficientFramesException("No raw frames left in " + night.name() + " for " + masterPath.getFileName());
    }

    BuildResult build(NightDirectory night, FrameCluster cluster, int radius) throws CalPipeException, IOException {
        if (cluster.members.isEmpty()) {
            throw new InsufficientFramesException("Cluster " + cluster + " has no frames");
        }
        MasterFrameName name = MasterFrameName.of(cluster);
        Path target = night.correctionDir().resolve(name.fileName());
        FrameType type = cluster.key.type();
        log.info("Building {} from {} frames", target.getFileName(), cluster.members.size());

        Set<FrameType> needed = calibrationFor(type);
        MatchResult match = needed.isEmpty()
                ? new MatchResult(Map.of(), Set.of())
                : matcher.match(CalibrationTarget.of(night, cluster), needed, radius);
        Map<FrameType, Integer> ages = match.ages();

        if (!needed.isEmpty()) {
            Set<FrameType> missing = missingMandatory(match);
            if (!missing.isEmpty()) {
                PendingEntry entry = PendingEntry.forProduct(PendingKind.forMaster(type), target, night,
                        cluster.key.binning(), cluster.key.filter(), cluster.representativeTime, ages,
                        config.getMaxSearchDays());
                throw new MissingMandatoryCalibrationException(target.getFileName().toString(), missing, entry);
            }
        }

        FitsImage bias = load(match, FrameType.BIAS);
        FitsImage dark = load(match, FrameType.DARK);

        List<float[][]> frames = new ArrayList<>();
        Header last = null;
        for (RawFrame member : cluster.members) {
            checkInterrupted(target);
            FitsImage raw = images.read(member.path());
            if (!frames.isEmpty() && !sameShape(frames.get(0), raw.data)) {
                throw new IOException("Frame " + member.path() + " differs in size from the rest of " + cluster);
            }
            frames.add(prepare(type, raw.data, bias, dark, member));
            last = raw.header;
        }

        checkInterrupted(target);
        float[][] combined = strategy.combine(frames);
        if (type == FrameType.DARK) {
            double exptime = cluster.meanExposureTime();
            if (exptime > 0) scale(combined, 1.0 / exptime);
            else log.warn("Dark cluster {} has no exposure time; master stays unscaled", cluster);
        } else if (type == FrameType.FLAT) {
            for (float[] row : combined) {
                for (int x = 0; x < row.length; x++) if (row[x] == 0f) row[x] = FLAT_FLOOR;
            }
        }

        Header header = images.copyHeader(last);
        HeaderKeys.put(header, "DATE-OBS", cluster.representativeTime.toString(), "Representative cluster time");
        if (type == FrameType.FLAT && cluster.key.filter() != null) {
            HeaderKeys.put(header, "FILTER", cluster.key.filter(), "Filter");
        }
        if (type == FrameType.DARK) {
            HeaderKeys.put(header, "EXPTIME", 1.0, "Dark master is per second");
        }
        HeaderKeys.putSources(header, cluster.memberPaths());
        for (FrameType used : needed) {
            CalibrationMatch m = match.get(used).orElse(null);
            if (m == null) continue;
            HeaderKeys.put(header, used.masterKey(), m.master().path.toString(), "Master " + used.label() + " used");
            HeaderKeys.put(header, used.ageKey(), m.ageDays(), "Relative age of master " + used.label() + " (days)");
        }

        checkInterrupted(target);
        images.write(target, combined, header);

        MasterFrame master = new MasterFrame(target, night, type, cluster.key.binning(), cluster.key.filter(),
                cluster.index, cluster.representativeTime, cluster.memberPaths());
        PendingEntry entry = null;
        if (!needed.isEmpty() && PendingEntry.needsFollowUp(ages)) {
            entry = PendingEntry.forProduct(PendingKind.forMaster(type), target, night, cluster.key.binning(),
                    cluster.key.filter(), cluster.representativeTime, ages, config.getMaxSearchDays());
            log.warn("Master {} built with calibration from other nights {}", target.getFileName(), ages);
        }
        return new BuildResult(master, entry);
    }

    private Set<FrameType> calibrationFor(FrameType type) {
        switch (type) {
            case DARK: return EnumSet.of(FrameType.BIAS);
            case FLAT: return config.isUseDark() ? EnumSet.of(FrameType.BIAS, FrameType.DARK) : EnumSet.of(FrameType.BIAS);
            default: return EnumSet.noneOf(FrameType.class);
        }
    }

    private Set<FrameType> missingMandatory(MatchResult match) {
        Set<FrameType> missing = EnumSet.noneOf(FrameType.class);
        for (FrameType t : match.unresolved()) {
            if (t == FrameType.BIAS || !config.isAllowPartial()) missing.add(t);
        }
        return missing;
    }

    private FitsImage load(MatchResult match, FrameType type) throws IOException {
        CalibrationMatch m = match.get(type).orElse(null);
        return m == null ? null : images.read(m.master().path);
    }

    private float[][] prepare(FrameType type, float[][] data, FitsImage bias, FitsImage dark, RawFrame frame)
            throws IOException {
        if (type == FrameType.BIAS) return data;
        float[][] out = new float[data.length][];
        for (int y = 0; y < data.length; y++) out[y] = data[y].clone();
        if (bias != null) {
            requireShape(bias, out, frame);
            subtract(out, bias.data, 1.0);
        }
        if (type == FrameType.FLAT) {
            if (dark != null) {
                requireShape(dark, out, frame);
                subtract(out, dark.data, frame.exposureTime());
            }
            double median = median(out);
            if (median != 0) scale(out, 1.0 / median);
            else log.warn("Flat {} has zero median after correction; left unnormalized", frame.path().getFileName());
        }
        return out;
    }

    private static void requireShape(FitsImage master, float[][] data, RawFrame frame) throws IOException {
        if (!sameShape(master.data, data)) {
            throw new IOException("Master frame size does not fit " + frame.path());
        }
    }

    private static boolean sameShape(float[][] a, float[][] b) {
        return a.length == b.length && (a.length == 0 || a[0].length == b[0].length);
    }

    static void subtract(float[][] data, float[][] other, double factor) {
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) data[y][x] = (float) (data[y][x] - other[y][x] * factor);
        }
    }

    static void scale(float[][] data, double factor) {
        for (float[] row : data) {
            for (int x = 0; x < row.length; x++) row[x] = (float) (row[x] * factor);
        }
    }

    static double median(float[][] data) {
        int n = 0;
        for (float[] row : data) n += row.length;
        if (n == 0) return 0;
        float[] all = new float[n];
        int i = 0;
        for (float[] row : data) {
            System.arraycopy(row, 0, all, i, row.length);
            i += row.length;
        }
        Arrays.sort(all);
        int mid = n / 2;
        return (n % 2 == 1) ? all[mid] : (all[mid - 1] + (double) all[mid]) / 2.0;
    }

    private static void checkInterrupted(Path target) throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Build of " + target.getFileName() + " cancelled");
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class BuildThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "master-build-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
