package io.finetl.campaign;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point. Configured entirely through {@code finetl.*} system properties or {@code FINETL_*} environment
 * variables; see {@link ProcessorConfig#fromEnv()}.
 */
public final class BulkFinanceMain {
    private static final Logger log = LoggerFactory.getLogger(BulkFinanceMain.class);

    private BulkFinanceMain() {}

    public static void main(String[] args) {
        ProcessorConfig cfg = ProcessorConfig.fromEnv();
        Injector injector = Guice.createInjector(new ProcessorModule(cfg));
        BulkFinanceProcessor processor = injector.getInstance(BulkFinanceProcessor.class);
        ReportGenerator reports = injector.getInstance(ReportGenerator.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        // On SIGINT the hook cancels, then holds the JVM until the partial report is out.
        CountDownLatch reported = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            processor.cancel();
            try {
                reported.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "bulk-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int exit = 0;
        try (Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.finetl.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build()) {
            if (cfg.metricsEverySeconds() > 0) reporter.start(cfg.metricsEverySeconds(), TimeUnit.SECONDS);
            ProcessingReport report = processor.run(cfg.inputDir());
            reporter.report();
            log.info("\n{}", reports.render(report));
            if (cfg.reportJson().isPresent()) {
                ReportJson.write(report, cfg.reportJson().get());
                log.info("report written to {}", cfg.reportJson().get());
            }
            if (!report.coverage().complete()) {
                log.warn("incomplete run: {} of {} expected files processed", report.coverage().filesProcessed(),
                        report.coverage().expectedFiles());
            }
        } catch (IOException e) {
            log.error("bulk run failed: {}", e.toString());
            exit = 2;
        } finally {
            reported.countDown();
        }

        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("shutdown in progress; leaving hook in place");
            return;
        }
        System.exit(exit);
    }
}
