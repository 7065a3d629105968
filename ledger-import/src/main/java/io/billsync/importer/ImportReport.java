package io.billsync.importer;

import io.billsync.ledger.BatchNumber;

/**
 * Outcome of one import run.
 *
 * @param uploaded rows accepted by the store; 0 on a dry run
 */
public record ImportReport(BatchNumber batch, int csvFiles, int extracted, int mapped, int uploaded, boolean dryRun) {}
