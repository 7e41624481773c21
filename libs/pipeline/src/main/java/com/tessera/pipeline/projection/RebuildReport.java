package com.tessera.pipeline.projection;

/**
 * Result of replaying the log into the projections.
 *
 * @param processed completed events replayed
 * @param projected those that carried AI metadata and were projected
 * @param errors those that could not be projected
 */
public record RebuildReport(int processed, int projected, int errors) {}
