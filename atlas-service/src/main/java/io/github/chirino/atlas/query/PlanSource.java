package io.github.chirino.atlas.query;

/** Where a query plan reads its rows from. */
public enum PlanSource {
    /** Nothing can match; the store is not consulted. */
    EMPTY,
    /** The precomputed date-sorted projection of positioned records. */
    SORTED_VIEW,
    /** The documents table with its spatial, vector and equality indexes. */
    BASE_TABLE
}
