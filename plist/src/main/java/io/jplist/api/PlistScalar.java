package io.jplist.api;

/**
 * A leaf value. Scalars are immutable and serve both as tree leaves and as stream events, so a
 * reader can hand the same instance to a tree builder that ends up storing it.
 */
public sealed interface PlistScalar extends PlistValue, PlistEvent
    permits PlistString, PlistBoolean, PlistReal, PlistInteger, PlistData, PlistDate, PlistUid {}
