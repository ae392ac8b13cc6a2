package com.mockinterview.platform.exception;

/**
 * Closed set of failure categories surfaced by the platform core.
 */
public enum ErrorKind {

    /** Invalid input or an operation attempted from the wrong session status. */
    CONFIGURATION,

    /** Any failure of a language-model call, including irrecoverable output. */
    AI_PROVIDER,

    /** Persistence failure after the retry budget is exhausted. */
    DATA_STORE,

    /** Media capture or storage failure not attributable to the database. */
    COMMUNICATION
}
