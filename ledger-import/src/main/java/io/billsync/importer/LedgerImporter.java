package io.billsync.importer;

import com.google.inject.Provider;
import io.billsync.bitable.BitableClient;
import io.billsync.bitable.StorePayload;
import io.billsync.core.Record;
import io.billsync.ledger.BatchNumber;
import io.billsync.ledger.FieldMapper;
import io.billsync.ledger.LedgerExtractor;
import io.billsync.ledger.LedgerRow;
import io.billsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one import: stage the input, extract and map every CSV member, then record a batch marker row
 * and upload the mapped rows in one batch.
 * <p>
 * The marker insert and the batch upload are separate calls; if the upload fails the marker stays.
 */
public class LedgerImporter {
    private static final Logger log = LoggerFactory.getLogger(LedgerImporter.class);

    public static final String MARKER_BATCH_NUMBER = "导入批次编号";
    public static final String MARKER_TIME = "时间";

    private final ImportConfig config;
    private final LedgerExtractor extractor;
    private final FieldMapper mapper;
    private final Provider<BitableClient> client;
    private final Clock clock;
    private final Metrics metrics;

    public LedgerImporter(ImportConfig config, LedgerExtractor extractor, FieldMapper mapper,
                          Provider<BitableClient> client, Clock clock, Metrics metrics) {
        this.config = config;
        this.extractor = extractor;
        this.mapper = mapper;
        this.client = client;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @param dryRun extract and map only; no configuration is required and nothing is sent
     * @throws ExtractionException on a missing or unusable input file
     * @throws ConfigException     if a real run lacks credentials or table ids
     * @throws io.billsync.bitable.BitableException on any remote failure
     */
    public ImportReport run(Path input, boolean dryRun) {
        BatchNumber batch = BatchNumber.at(clock);
        log.info("Importing {} as batch {}", input, batch);

        List<Record<LedgerRow>> rows = new ArrayList<>();
        int files = 0;
        try (LedgerArchive archive = LedgerArchive.open(input);
             LedgerFileSource source = new LedgerFileSource(archive.csvFiles())) {
            Optional<Record<LedgerFile>> next;
            while ((next = source.poll()).isPresent()) {
                Record<LedgerFile> file = next.get();
                files++;
                List<LedgerRow> extracted = extractor.extract(new ByteArrayInputStream(file.payload().data()), batch.value());
                log.debug("{}: {} rows", file.payload().name(), extracted.size());
                for (int i = 0; i < extracted.size(); i++) {
                    rows.add(new Record<>(file.seq(), i, extracted.get(i)));
                }
            }
        } catch (IOException e) {
            throw new ExtractionException("reading ledger " + input + " failed: " + e.getMessage(), e);
        }
        metrics.inc("import.rows.extracted", rows.size());
        log.info("Extracted {} rows from {} CSV file(s)", rows.size(), files);
        if (log.isDebugEnabled()) {
            rows.forEach(r -> log.debug("row {}", r.payload()));
        }

        List<Record<StorePayload>> mapped = new ArrayList<>(rows.size());
        for (Record<LedgerRow> r : rows) {
            mapped.addAll(mapper.apply(r));
        }
        if (log.isDebugEnabled()) {
            mapped.forEach(r -> log.debug("payload {}", r.payload().fields()));
        }

        if (dryRun) {
            log.info("[dry run] {} rows mapped for batch {}, nothing sent", mapped.size(), batch);
            return new ImportReport(batch, files, rows.size(), mapped.size(), 0, true);
        }

        config.requireRemote().requireTables();
        BitableClient bitable = client.get();

        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put(MARKER_BATCH_NUMBER, batch.value());
        marker.put(MARKER_TIME, batch.startedAtMillis());
        bitable.insertRecord(config.appToken(), config.batchTableId(), marker);
        log.info("Recorded batch {} in table {}", batch, config.batchTableId());

        if (mapped.isEmpty()) {
            log.warn("No income/expense rows in {}; nothing to upload", input);
            return new ImportReport(batch, files, rows.size(), 0, 0, false);
        }
        BitableBatchSink sink = new BitableBatchSink(bitable, config.appToken(), config.billingTableId());
        sink.acceptBatch(mapped);
        metrics.inc("import.rows.uploaded", mapped.size());
        log.info("Uploaded {} rows to table {}", mapped.size(), config.billingTableId());
        return new ImportReport(batch, files, rows.size(), mapped.size(), mapped.size(), false);
    }
}
