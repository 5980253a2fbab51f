package io.finetl.campaign;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.finetl.core.Sink;
import io.finetl.metrics.Metrics;

public class ProcessorModule extends AbstractModule {
    private final ProcessorConfig config;

    public ProcessorModule(ProcessorConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(ProcessorConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton TaxIdValidator taxIdValidator() {
        return config.validateTaxIds() ? new BrazilianTaxIds() : TaxIdValidator.ANY;
    }

    @Provides @Singleton RecordValidator recordValidator(TaxIdValidator taxIds) { return new RecordValidator(taxIds); }

    @Provides EncodingDetector encodingDetector() { return new EncodingDetector(); }

    @Provides FileClassifier fileClassifier() { return new FileClassifier(); }

    @Provides @Singleton ReportGenerator reportGenerator() {
        return new ReportGenerator(config.topN(), config.expectedSubdivisions(), config.coverageThreshold(),
                config.volumeThreshold());
    }

    @Provides @Singleton CountingSink countingSink() { return new CountingSink(); }

    @Provides Sink<FinanceRecord> sink(CountingSink sink) { return sink; }

    @Provides @Singleton BulkFinanceProcessor processor(FileClassifier classifier, EncodingDetector detector,
                                                        RecordValidator validator, ReportGenerator reports,
                                                        Sink<FinanceRecord> sink, Metrics metrics) {
        return new BulkFinanceProcessor(config, classifier, detector, validator, reports, sink, metrics);
    }
}
