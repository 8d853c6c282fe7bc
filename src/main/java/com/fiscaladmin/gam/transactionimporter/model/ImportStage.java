package com.fiscaladmin.gam.transactionimporter.model;

/**
 * Per-file pipeline stages, in execution order. {@link #FAILED} can be
 * reached from any stage before {@link #DONE}.
 */
public enum ImportStage {
    DETECTING,
    MAPPING,
    VALIDATING,
    DEDUPLICATING,
    PERSISTING,
    ARCHIVING,
    DONE,
    FAILED
}
