package com.sparkify.etl;

/**
 * How songplay_id values are generated. Ids are unique within one run only.
 */
public enum SurrogateKeyStrategy {
    /** Dense 0-based counter, assigned in start_time, userId order. */
    SEQUENTIAL,
    /** Engine-provided increasing id; gaps depend on partition layout. */
    MONOTONIC
}
