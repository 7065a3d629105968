package io.billsync.importer;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.billsync.bitable.BitableClient;
import io.billsync.ledger.FieldMapper;
import io.billsync.ledger.LedgerDecoder;
import io.billsync.ledger.LedgerExtractor;
import io.billsync.metrics.Metrics;

import java.net.http.HttpClient;
import java.time.Clock;

public class ImportModule extends AbstractModule {
    private final ImportConfig config;
    private final Clock clock;

    public ImportModule(ImportConfig config) { this(config, Clock.systemDefaultZone()); }

    public ImportModule(ImportConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        bind(ImportConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build();
    }

    @Provides @Singleton BitableClient bitableClient(HttpClient http, ObjectMapper json, Metrics metrics) {
        return new BitableClient(config.baseUrl(), config.appId(), config.appSecret(), http, json,
                config.requestTimeout(), metrics);
    }

    @Provides LedgerExtractor extractor(Metrics metrics) { return new LedgerExtractor(new LedgerDecoder(), metrics); }

    @Provides FieldMapper mapper() { return new FieldMapper(config.zone()); }

    @Provides LedgerImporter importer(LedgerExtractor extractor, FieldMapper mapper, Provider<BitableClient> client, Metrics metrics) {
        return new LedgerImporter(config, extractor, mapper, client, clock, metrics);
    }
}
