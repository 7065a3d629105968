package io.billsync.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Stages an input ledger in a private temp directory: zip archives are extracted, anything else is
 * copied. Closing removes the directory.
 */
public final class LedgerArchive implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(LedgerArchive.class);

    // Alipay writes member names in GBK without the zip UTF-8 flag
    private static final List<Charset> ENTRY_NAME_CHARSETS = List.of(StandardCharsets.UTF_8, Charset.forName("GBK"));

    private final Path workDir;
    private final List<Path> csvFiles;

    private LedgerArchive(Path workDir, List<Path> csvFiles) {
        this.workDir = workDir;
        this.csvFiles = csvFiles;
    }

    /**
     * @throws ExtractionException if the input does not exist, cannot be staged, or holds no .csv file
     */
    public static LedgerArchive open(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new ExtractionException("ledger file not found: " + input);
        }
        Path dir;
        try {
            dir = Files.createTempDirectory("ledger-import-");
        } catch (IOException e) {
            throw new ExtractionException("cannot create temp directory for " + input, e);
        }
        log.debug("Staging {} in {}", input, dir);
        try {
            if (isZip(input)) {
                unzip(input, dir);
            } else {
                Files.copy(input, dir.resolve(input.getFileName().toString()), StandardCopyOption.COPY_ATTRIBUTES);
            }
            List<Path> csv = findCsv(dir);
            log.debug("CSV members: {}", csv);
            if (csv.isEmpty()) {
                throw new ExtractionException("no CSV file found in " + input);
            }
            return new LedgerArchive(dir, csv);
        } catch (IOException e) {
            deleteTree(dir);
            throw new ExtractionException("cannot stage " + input + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteTree(dir);
            throw e;
        }
    }

    public Path workDir() { return workDir; }

    /** Staged .csv files, path-sorted. */
    public List<Path> csvFiles() { return csvFiles; }

    @Override
    public void close() {
        log.debug("Removing {}", workDir);
        deleteTree(workDir);
    }

    static boolean isZip(Path p) {
        return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static void unzip(Path zip, Path dir) throws IOException {
        ZipException last = null;
        for (Charset cs : ENTRY_NAME_CHARSETS) {
            try {
                unzip(zip, dir, cs);
                return;
            } catch (ZipException e) {
                last = e;
            } catch (IllegalArgumentException e) {
                last = new ZipException("entry name not valid " + cs.name() + ": " + e.getMessage());
            }
            log.debug("Reading {} with {} entry names failed: {}", zip, cs.name(), last.getMessage());
            clearDir(dir);
        }
        throw last;
    }

    private static void unzip(Path zip, Path dir, Charset names) throws IOException {
        try (ZipFile zf = new ZipFile(zip.toFile(), names)) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                ZipEntry e = entries.nextElement();
                Path target = dir.resolve(e.getName()).normalize();
                if (!target.startsWith(dir)) {
                    throw new ExtractionException("archive entry escapes extraction directory: " + e.getName());
                }
                if (e.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zf.getInputStream(e)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private static List<Path> findCsv(Path dir) throws IOException {
        try (Stream<Path> s = Files.walk(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }
    }

    private static void clearDir(Path dir) throws IOException {
        try (Stream<Path> s = Files.walk(dir)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                if (!p.equals(dir)) Files.deleteIfExists(p);
            }
        }
    }

    private static void deleteTree(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> s = Files.walk(dir)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not fully remove {}: {}", dir, e.toString());
        }
    }
}
