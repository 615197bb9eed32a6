package com.txengine.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Counters describing a completed processing run.
 */
@Value
@Builder
public class ProcessingSummary {
    long recordsRead;
    long applied;
    long ignored;
    int accounts;
}
