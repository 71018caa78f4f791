package com.bashnorm.error;

public enum ErrorKind {
    /** The external parser produced no tree. */
    PARSE_REJECTED,
    /** Recognized syntax that is out of scope (loops, redirects, lists...). */
    UNSUPPORTED_CONSTRUCT,
    /** An invariant of the canonical tree cannot be satisfied. */
    STRUCTURAL_INCONSISTENCY,
    /** Repaired in place; never fatal. */
    RECOVERABLE_REPAIR
}
