package com.aporkolab.redelivery.core;

/**
 * How the dead-letter partition is chosen.
 */
public enum PartitionStrategy {

    /**
     * Every record goes to one configured partition (0 by default).
     * Dead-letter volume is low; the original partition stays available as a header.
     */
    FIXED,

    /**
     * Same partition number as the source record. Requires the dead-letter topic to have
     * at least as many partitions as the source; keeps per-partition ordering.
     */
    MIRROR
}
