package com.contrastsecurity.tpack.model;

/**
 * Non-fatal conditions reported alongside a successful package result.
 */
public enum WarningType {
    /** File could not be tokenised; references were recovered by a textual scan. */
    PARSE_DEGRADED,
    /** Referenced entity is not declared by any indexed package. */
    UNRESOLVED_REFERENCE,
    /** Referenced entity is declared by more than one indexed package. */
    AMBIGUOUS_REFERENCE,
    /** Contributed entities do not share the package namespace. */
    NAMESPACE_INCONSISTENCY,
    /** Package has a namespace but no {namespace}_version action. */
    MISSING_VERSION_ACTION,
    /** Entity under the package's own namespace is used but never declared. */
    SELF_NAMESPACE_UNDECLARED
}
