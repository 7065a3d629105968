package io.billsync.importer;

/** A staged CSV member, read whole. */
public record LedgerFile(String name, byte[] data) {}
