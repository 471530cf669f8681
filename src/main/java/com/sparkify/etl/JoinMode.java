package com.sparkify.etl;

/**
 * How log events are matched against songs when building songplays.
 */
public enum JoinMode {
    /** Drop plays with no matching song. */
    INNER("inner"),
    /** Keep unmatched plays with null song_id and artist_id. */
    LEFT("left_outer");

    private final String sparkJoinType;

    JoinMode(String sparkJoinType) {
        this.sparkJoinType = sparkJoinType;
    }

    public String sparkJoinType() {
        return sparkJoinType;
    }
}
