package com.astro.calpipe.service;

import com.astro.calpipe.model.NightDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies a night's frames from the telescope side into the night's {@code Raw} directory,
 * stamping the telescope-side path into {@code KW-TRAW}. Files already copied are left alone.
 */
public class BackupService {
    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final FitsImageService images;
    private final Path telescopeRoot;

    public BackupService(FitsImageService images, Path telescopeRoot) {
        this.images = images;
        this.telescopeRoot = telescopeRoot;
    }

    /** Telescope-side directory of a night, or {@code null} when no telescope root is configured. */
    public Path sourceDir(NightDirectory night) {
        return telescopeRoot == null ? null : telescopeRoot.resolve(night.name());
    }

    /**
     * @return the files that were copied in this call
     * @throws IOException on the first file that cannot be copied; files copied before stay in place
     */
    public List<Path> backup(NightDirectory night) throws IOException {
        Path source = sourceDir(night);
        if (source == null || !Files.isDirectory(source)) {
            log.info("No telescope directory for {}, nothing to back up", night.name());
            return List.of();
        }
        Files.createDirectories(night.rawDir());
        List<Path> copied = new ArrayList<>();
        for (Path file : FrameIndexService.listFits(source)) {
            Path target = night.rawDir().resolve(file.getFileName().toString());
            if (Files.exists(target)) {
                log.debug("{} already backed up", target.getFileName());
                continue;
            }
            String telescopePath = file.toAbsolutePath().toString();
            images.rewriteHeader(file, target,
                    h -> HeaderKeys.put(h, HeaderKeys.TRAW, telescopePath, "Raw file, telescope side"));
            copied.add(target);
        }
        log.info("Backed up {} frames of {} from {}", copied.size(), night.name(), source);
        return copied;
    }
}
