package com.gomesguardian.common.synthesis;

/**
 * Outcome of merging new information into a thesis.
 *
 * <pre>
 *   CREATED    no thesis existed; one was created
 *   CONFLICT   conflicts with the stored thesis were found
 *   UPDATED    score or content moved without conflicts
 *   NO_CHANGE  nothing material was detected; the entry is still recorded
 * </pre>
 */
public enum MergeAction {
    CREATED,
    UPDATED,
    CONFLICT,
    NO_CHANGE
}
