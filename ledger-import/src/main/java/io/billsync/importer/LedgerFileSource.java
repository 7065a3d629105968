package io.billsync.importer;

import io.billsync.core.Record;
import io.billsync.core.Source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Emits one record per ledger file with the whole file as payload, in the given order.
 * seq is the file's index.
 */
public class LedgerFileSource implements Source<LedgerFile> {
    private final List<Path> files;
    private int idx = 0;

    public LedgerFileSource(List<Path> files) {
        this.files = List.copyOf(files);
    }

    @Override
    public Optional<Record<LedgerFile>> poll() throws IOException {
        if (idx >= files.size()) return Optional.empty();
        Path p = files.get(idx);
        byte[] data = Files.readAllBytes(p);
        Record<LedgerFile> r = Record.of(idx, new LedgerFile(p.getFileName().toString(), data));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= files.size();
    }
}
