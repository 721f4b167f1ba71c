package com.adlanda.ethicsassistant.exception;

/**
 * Classifies a failure so call sites can decide whether to continue, degrade or abort.
 */
public enum ErrorKind {
    /** Unusable settings at startup. Fatal. */
    CONFIGURATION,
    /** A collaborator could not be reached. */
    CONNECTIVITY,
    STORAGE,
    EXTRACTION,
    EMBEDDING,
    INDEX,
    GENERATION,
    /** Caller input outside the contract, rejected before any work begins. */
    VALIDATION,
    INGESTION
}
