package com.astro.calpipe.model;

/**
 * The master chosen for one calibration type.
 *
 * @param ageDays signed night offset between the calibrated frame and the master (negative: past)
 */
public record CalibrationMatch(MasterFrame master, int ageDays) {
}
