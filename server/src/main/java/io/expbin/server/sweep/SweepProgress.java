package io.expbin.server.sweep;

/**
 * Point-in-time counters of a sweep job.
 *
 * @param recordsVisited records handed to the sweep by the scan
 * @param recordsCleaned records that had at least one field removed
 * @param binsRemoved    fields removed (value bin and marker bin count as one)
 * @param errors         records skipped because of an error
 * @param lastKey        user key of the last visited record, null before the first one
 */
public record SweepProgress(long recordsVisited, long recordsCleaned, long binsRemoved, long errors, String lastKey) {
}
