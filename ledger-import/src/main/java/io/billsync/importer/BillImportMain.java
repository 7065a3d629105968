package io.billsync.importer;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.billsync.bitable.BitableClient;
import io.billsync.bitable.BitableException;
import io.billsync.ledger.FieldMapper;
import io.billsync.ledger.LedgerDecodeException;
import io.billsync.ledger.TransactionKind;
import io.billsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI to import Alipay bill exports into Feishu Bitable and to list what is already there.
 */
@CommandLine.Command(name = "bill-import", mixinStandardHelpOptions = true,
        description = "Import Alipay bills into Feishu Bitable",
        subcommands = {BillImportMain.ImportCommand.class, BillImportMain.ListCommand.class})
public final class BillImportMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(BillImportMain.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new BillImportMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_FAILURE;
    }

    @CommandLine.Command(name = "import", mixinStandardHelpOptions = true, description = "Import a bill file (.csv or .zip)")
    static final class ImportCommand implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Bill file path")
        Path file;

        @CommandLine.Option(names = "--dry-run", description = "Extract and map only; send nothing to Feishu")
        boolean dryRun;

        @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log extracted rows and request bodies")
        boolean verbose;

        @Override
        public Integer call() {
            verbose(verbose);
            try {
                ImportConfig cfg = ImportConfig.fromEnv();
                Injector injector = Guice.createInjector(new ImportModule(cfg));
                ImportReport report = injector.getInstance(LedgerImporter.class).run(file, dryRun);
                System.out.println("Batch " + report.batch() + ": files=" + report.csvFiles()
                        + " extracted=" + report.extracted() + " mapped=" + report.mapped()
                        + " uploaded=" + report.uploaded() + (report.dryRun() ? " (dry run)" : ""));
                System.out.println("metrics: " + injector.getInstance(Metrics.class).summary(""));
                return 0;
            } catch (ConfigException e) {
                log.error("{}", e.getMessage());
                return EXIT_CONFIG;
            } catch (ExtractionException | LedgerDecodeException | BitableException e) {
                fail("Import failed", e, verbose);
                return EXIT_FAILURE;
            }
        }
    }

    @CommandLine.Command(name = "ls", mixinStandardHelpOptions = true, description = "List records of a Bitable table")
    static final class ListCommand implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--billing", description = "List the billing table instead of the batch table")
        boolean billing;

        @CommandLine.Option(names = "--table-id", description = "Table to list; overrides --billing")
        String tableId;

        @CommandLine.Option(names = "--type", description = "Only records whose 收支 is this value (收入 or 支出)")
        String type;

        @CommandLine.Option(names = "--page-size", description = "Records per page", defaultValue = "100")
        int pageSize;

        @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log request bodies")
        boolean verbose;

        @Override
        public Integer call() throws Exception {
            verbose(verbose);
            if (type != null && TransactionKind.fromLabel(type).isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--type must be 收入 or 支出, got: " + type);
            }
            if (pageSize <= 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--page-size must be positive");
            }
            try {
                ImportConfig cfg = ImportConfig.fromEnv().requireRemote();
                Injector injector = Guice.createInjector(new ImportModule(cfg));
                BitableClient client = injector.getInstance(BitableClient.class);
                String table = tableId != null ? tableId : billing ? cfg.billingTableId() : cfg.batchTableId();

                List<JsonNode> records = client.searchRecords(cfg.appToken(), table, kindFilter(type), pageSize);
                ObjectMapper json = injector.getInstance(ObjectMapper.class);
                PrintWriter out = spec.commandLine().getOut();
                out.println("Fetched " + records.size() + " records:");
                out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(records));
                out.flush();
                return 0;
            } catch (ConfigException e) {
                log.error("{}", e.getMessage());
                return EXIT_CONFIG;
            } catch (BitableException e) {
                fail("Listing failed", e, verbose);
                return EXIT_FAILURE;
            }
        }
    }

    /** Bitable filter matching 收支 == kind, or null for no filter. */
    static Map<String, Object> kindFilter(String kind) {
        if (kind == null) return null;
        return Map.of(
                "conjunction", "and",
                "conditions", List.of(Map.of(
                        "field_name", FieldMapper.KIND,
                        "operator", "is",
                        "value", List.of(kind))));
    }

    private static void fail(String what, Exception e, boolean verbose) {
        if (verbose) {
            log.error("{}: {}", what, e.getMessage(), e);
        } else {
            log.error("{}: {}", what, e.getMessage());
        }
    }

    private static void verbose(boolean on) {
        if (!on) return;
        if (LoggerFactory.getLogger("io.billsync") instanceof ch.qos.logback.classic.Logger l) {
            l.setLevel(Level.DEBUG);
        }
    }
}
