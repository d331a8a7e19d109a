package com.fintech.bars.storage;

/** Outcome of an idempotent bar write. */
public enum UpsertResult {
    INSERTED,
    UPDATED
}
