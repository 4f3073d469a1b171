package com.astro.calpipe.error;

import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.PendingEntry;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A required master (always bias; dark/flat when partial reduction is off) could not be found
 * within the search radius. Carries the ledger row to log so a later pass can retry.
 */
public class MissingMandatoryCalibrationException extends CalPipeException {
    private final Set<FrameType> missing;
    private final transient PendingEntry pendingEntry;

    public MissingMandatoryCalibrationException(String subject, Set<FrameType> missing, PendingEntry pendingEntry) {
        super("No suitable master " + missing + " for " + subject);
        this.missing = EnumSet.copyOf(missing);
        this.pendingEntry = pendingEntry;
    }

    public Set<FrameType> missing() {
        return EnumSet.copyOf(missing);
    }

    public Optional<PendingEntry> pendingEntry() {
        return Optional.ofNullable(pendingEntry);
    }
}
