package io.finetl.campaign;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.finetl.core.Record;
import io.finetl.core.Sink;
import io.finetl.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.NotDirectoryException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BulkFinanceProcessorTest {
    private Path dir;

    static class CapturingSink implements Sink<FinanceRecord> {
        final List<FinanceRecord> seen = new CopyOnWriteArrayList<>();
        @Override public void accept(Record<FinanceRecord> record) { seen.add(record.payload()); }
    }

    @BeforeEach
    void setUp() throws IOException {
        dir = Files.createTempDirectory("bulk");
    }

    @AfterEach
    void tearDown() throws IOException {
        TestFiles.deleteRecursively(dir);
    }

    @Test
    void scenarioA_revenueRowsAreValidatedOneByOne() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_2022_SP.csv",
                "NR_CPF_CANDIDATO;VR_RECEITA;SG_UF\n111;100.00;SP\n222;0;RJ\n;50.00;MG\n");
        CapturingSink sink = new CapturingSink();

        ProcessingReport report = processor(config(), sink, new MetricRegistry()).run(dir);

        AggregateStats s = report.stats();
        assertEquals(1, s.filesProcessed());
        assertEquals(3, s.totalRecords());
        assertEquals(1, s.validRecords());
        assertEquals(2, s.invalidRecords());
        assertEquals(Map.of("SP", 1L), s.recordsByGeographicUnit());

        FileStats f = report.files().get(0);
        assertEquals(Map.of(Rejection.NON_POSITIVE_AMOUNT, 1L, Rejection.MISSING_FIELD, 1L), f.rejections());
        assertEquals(0, new BigDecimal("100.00").compareTo(f.validAmount()));
        assertTrue(f.error().isEmpty());
        assertFalse(f.schemaDriftSuspected());

        assertEquals(1, sink.seen.size());
        FinanceRecord r = sink.seen.get(0);
        assertEquals("111", r.fields().get("NR_CPF_CANDIDATO"));
        assertEquals("100.00", r.fields().get("VR_RECEITA"));
        assertEquals("SP", r.fields().get("SG_UF"));
        assertEquals(1, r.rowNumber());
    }

    @Test
    void scenarioB_unclassifiedFilesAreOnlyCountedAsSkipped() throws Exception {
        TestFiles.write(dir, "despesas_pagas_candidatos_2022_RJ.csv", TestFiles.rows(TestFiles.PAID_HEADER, 4, "RJ"));
        TestFiles.write(dir, "outros_metadados.csv", TestFiles.rows(TestFiles.PAID_HEADER, 9, "SP"));
        MetricRegistry registry = new MetricRegistry();

        ProcessingReport report = processor(config(), new CapturingSink(), registry).run(dir);

        assertEquals(1, report.stats().filesProcessed());
        assertEquals(1, report.stats().files(RecordType.PAID_EXPENSE));
        assertEquals(4, report.stats().totalRecords());
        assertEquals(List.of(dir.resolve("outros_metadados.csv")), report.skipped());
        assertEquals(1, registry.counter("processor.files.skipped").getCount());
    }

    @Test
    void scenarioC_singleByteFilesDecodeWithoutAborting() throws Exception {
        TestFiles.write(dir, "despesas_pagas_SP.csv",
                "NR_CPF_CANDIDATO;SG_UF;VR_PAGAMENTO;DS_FORNECEDOR\n1;SP;10,00;Conceição\n2;SP;5,00;Pão\n3;SP;1,00;Ação\n");
        TestFiles.write(dir, "despesas_pagas_RJ.csv",
                "NR_CPF_CANDIDATO;SG_UF;VR_PAGAMENTO;DS_FORNECEDOR\n1;RJ;10,00;“Gráfica” Ltda\n2;RJ;5,00;Café\n",
                EncodingDetector.WINDOWS_1252);
        CapturingSink sink = new CapturingSink();

        ProcessingReport report = processor(config(), sink, new MetricRegistry()).run(dir);

        assertEquals(5, report.stats().validRecords());
        assertTrue(report.filesWithErrors().isEmpty());
        FileStats rj = report.files().get(0);
        assertEquals(EncodingDetector.WINDOWS_1252, rj.detection().orElseThrow().charset());
        FileStats sp = report.files().get(1);
        assertEquals("ISO-8859-1", sp.detection().orElseThrow().charset().name());
        assertTrue(sink.seen.stream().anyMatch(r -> "“Gráfica” Ltda".equals(r.fields().get("DS_FORNECEDOR"))));
        assertTrue(sink.seen.stream().anyMatch(r -> "Conceição".equals(r.fields().get("DS_FORNECEDOR"))));
    }

    @Test
    void manyFilesOnAPoolWiredByGuice() throws Exception {
        String[] units = {"SP", "RJ", "MG"};
        for (String uf : units) {
            TestFiles.write(dir, "receitas_candidatos_2022_" + uf + ".csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 300, uf));
            TestFiles.write(dir, "receitas_candidatos_doador_originario_2022_" + uf + ".csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 50, uf));
            TestFiles.write(dir, "despesas_contratadas_candidatos_2022_" + uf + ".csv",
                    TestFiles.rows("NR_CPF_CANDIDATO;SG_UF;VR_DESPESA_CONTRATADA", 120, uf));
            TestFiles.write(dir, "despesas_pagas_candidatos_2022_" + uf + ".csv", TestFiles.rows(TestFiles.PAID_HEADER, 80, uf) + ";" + uf + ";1,00\n");
        }
        Injector injector = Guice.createInjector(new ProcessorModule(config().withWorkers(4)));
        BulkFinanceProcessor processor = injector.getInstance(BulkFinanceProcessor.class);
        CountingSink sink = injector.getInstance(CountingSink.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        ProcessingReport report = processor.run(dir);

        AggregateStats s = report.stats();
        assertEquals(12, s.filesProcessed());
        assertEquals(3 * (300 + 50 + 120 + 81), s.totalRecords());
        assertEquals(3, s.invalidRecords());
        assertEquals(900, s.records(RecordType.REVENUE));
        assertEquals(Map.of("SP", 550L, "RJ", 550L, "MG", 550L), s.recordsByGeographicUnit());
        assertEquals(s.validRecords(), sink.total());
        assertEquals(240, sink.count(RecordType.PAID_EXPENSE));
        assertEquals(s.totalRecords(), registry.meter("processor.rows.rate").getCount());
        assertEquals(s.validRecords(), registry.meter("sink.dispatch.output.rate").getCount());
        assertEquals(0, report.sinkFailures());
        for (FileStats f : report.files()) assertEquals(f.rowsProcessed(), f.valid() + f.invalid());
    }

    @Test
    void unreadableFileIsRecordedAndTheRunContinues() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_SP.csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 10, "SP"));
        FileDescriptor ghost = new FileDescriptor(dir.resolve("receitas_candidatos_gone.csv"), RecordType.REVENUE, 0);
        FileClassifier withGhost = new FileClassifier() {
            @Override
            public Classification classify(Path d) throws IOException {
                Classification real = super.classify(d);
                Map<RecordType, List<FileDescriptor>> byType = new EnumMap<>(real.byType());
                List<FileDescriptor> revenue = new ArrayList<>(real.files(RecordType.REVENUE));
                revenue.add(ghost);
                byType.put(RecordType.REVENUE, revenue);
                return new Classification(byType, real.skipped());
            }
        };
        MetricRegistry registry = new MetricRegistry();
        ProcessorConfig cfg = config();
        BulkFinanceProcessor processor = new BulkFinanceProcessor(cfg, withGhost, new EncodingDetector(), new RecordValidator(),
                new ReportGenerator(cfg.topN(), cfg.expectedSubdivisions(), cfg.coverageThreshold(), cfg.volumeThreshold()), new CapturingSink(),
                new Metrics(registry));

        ProcessingReport report = processor.run(dir);

        assertEquals(2, report.stats().filesProcessed());
        assertEquals(1, report.stats().filesFailed());
        assertEquals(10, report.stats().totalRecords());
        FileStats failed = report.files().stream().filter(f -> f.fileName().equals("receitas_candidatos_gone.csv")).findFirst().orElseThrow();
        assertEquals(FileError.Kind.IO_FAILURE, failed.error().orElseThrow().kind());
        assertEquals(0, failed.rowsProcessed());
        assertEquals(1, registry.counter("processor.files.failed").getCount());
    }

    @Test
    void missingInputDirectoryFailsBeforeAnyWork() {
        BulkFinanceProcessor processor = processor(config(), new CapturingSink(), new MetricRegistry());
        assertThrows(NotDirectoryException.class, () -> processor.run(dir.resolve("absent")));
    }

    @Test
    void cancellationStopsAtARowBoundaryAndKeepsTheReportConsistent() throws Exception {
        for (String uf : new String[] {"AC", "BA", "SP"}) {
            TestFiles.write(dir, "receitas_candidatos_" + uf + ".csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 500, uf));
        }
        AtomicReference<BulkFinanceProcessor> ref = new AtomicReference<>();
        Sink<FinanceRecord> cancelling = r -> ref.get().cancel();
        BulkFinanceProcessor processor = processor(config().withWorkers(1).withSink(1, 1, 5_000), cancelling, new MetricRegistry());
        ref.set(processor);

        ProcessingReport report = processor.run(dir);

        assertTrue(report.cancelled());
        AggregateStats s = report.stats();
        assertEquals(1, s.filesProcessed());
        FileStats partial = report.files().get(0);
        assertEquals("receitas_candidatos_AC.csv", partial.fileName());
        assertEquals(FileError.Kind.CANCELLED, partial.error().orElseThrow().kind());
        assertTrue(partial.rowsProcessed() < 500, "stopped early: " + partial.rowsProcessed());
        assertEquals(partial.rowsProcessed(), s.totalRecords());
        assertEquals(s.totalRecords(), s.records(RecordType.REVENUE));
        assertEquals(partial.rowsProcessed(), partial.valid() + partial.invalid());
    }

    @Test
    void aCancelledRunDoesNotCancelTheNext() throws Exception {
        for (String uf : new String[] {"AC", "BA", "SP"}) {
            TestFiles.write(dir, "receitas_candidatos_" + uf + ".csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 500, uf));
        }
        AtomicReference<BulkFinanceProcessor> ref = new AtomicReference<>();
        AtomicBoolean cancelFirstRun = new AtomicBoolean(true);
        Sink<FinanceRecord> sink = r -> {
            if (cancelFirstRun.getAndSet(false)) ref.get().cancel();
        };
        BulkFinanceProcessor processor = processor(config().withWorkers(1).withSink(1, 1, 5_000), sink, new MetricRegistry());
        ref.set(processor);

        assertTrue(processor.run(dir).cancelled());
        assertTrue(processor.isCancelled());

        ProcessingReport second = processor.run(dir);

        assertFalse(second.cancelled());
        assertFalse(processor.isCancelled());
        assertEquals(3, second.stats().filesProcessed());
        assertEquals(1_500, second.stats().totalRecords());
        assertTrue(second.filesWithErrors().isEmpty());
    }

    @Test
    void interruptingTheRunCancelsIt() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_SP.csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 1_000, "SP"));
        CountDownLatch firstSeen = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Sink<FinanceRecord> gated = r -> {
            firstSeen.countDown();
            release.await();
        };
        BulkFinanceProcessor processor = processor(config().withWorkers(1).withSink(1, 1, 10_000), gated, new MetricRegistry());
        AtomicReference<ProcessingReport> result = new AtomicReference<>();
        AtomicBoolean stillInterrupted = new AtomicBoolean();
        Thread runner = new Thread(() -> {
            try {
                result.set(processor.run(dir));
                stillInterrupted.set(Thread.currentThread().isInterrupted());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        runner.start();
        try {
            assertTrue(firstSeen.await(5, TimeUnit.SECONDS));
            runner.interrupt();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!processor.isCancelled() && System.nanoTime() < deadline) Thread.sleep(5);
            assertTrue(processor.isCancelled());
        } finally {
            release.countDown();
        }
        runner.join(10_000);

        ProcessingReport report = result.get();
        assertNotNull(report);
        assertTrue(report.cancelled());
        assertTrue(stillInterrupted.get());
        assertEquals(FileError.Kind.CANCELLED, report.files().get(0).error().orElseThrow().kind());
        assertTrue(report.stats().totalRecords() < 1_000);
    }

    @Test
    void blockedSinkTimesOutAndCancels() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_SP.csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 50, "SP"));
        TestFiles.write(dir, "receitas_candidatos_RJ.csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 50, "RJ"));
        CountDownLatch never = new CountDownLatch(1);
        Sink<FinanceRecord> stuck = r -> never.await();
        try {
            BulkFinanceProcessor processor = processor(config().withWorkers(1).withSink(1, 1, 200), stuck, new MetricRegistry());

            ProcessingReport report = processor.run(dir);

            assertTrue(report.cancelled());
            assertEquals(1, report.stats().filesProcessed());
            FileStats f = report.files().get(0);
            assertEquals(FileError.Kind.SINK_TIMEOUT, f.error().orElseThrow().kind());
            assertTrue(f.rowsProcessed() < 50);
            // the blocked record and the one queued behind it never reached the sink; the third was never enqueued
            assertEquals(2, report.sinkFailures());
            assertEquals(f.valid() - 1, report.sinkFailures());
        } finally {
            never.countDown();
        }
    }

    @Test
    void schemaDriftIsFlaggedAndLogged() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_renamed.csv", TestFiles.rows("NR_CPF_CANDIDATO;SG_UF;VALOR_RECEITA", 20, "SP"));
        StringBuilder blankIds = new StringBuilder(TestFiles.REVENUE_HEADER).append('\n');
        for (int i = 0; i < 12; i++) blankIds.append(";SP;10,00\n");
        TestFiles.write(dir, "receitas_candidatos_blank_ids.csv", blankIds.toString());
        TestFiles.write(dir, "receitas_candidatos_small.csv", TestFiles.REVENUE_HEADER + "\n;SP;1\n;SP;2\n");
        TestFiles.write(dir, "receitas_candidatos_ok.csv", TestFiles.rows(TestFiles.REVENUE_HEADER, 20, "SP"));

        ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(BulkFinanceProcessor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        ProcessingReport report;
        try {
            report = processor(config(), new CapturingSink(), new MetricRegistry()).run(dir);
        } finally {
            logger.detachAppender(appender);
        }

        List<String> drifted = report.schemaDriftFiles().stream().map(FileStats::fileName).toList();
        assertEquals(List.of("receitas_candidatos_blank_ids.csv", "receitas_candidatos_renamed.csv"), drifted);
        FileStats renamed = report.files().stream().filter(f -> f.fileName().equals("receitas_candidatos_renamed.csv")).findFirst().orElseThrow();
        assertEquals(List.of("VR_RECEITA"), renamed.missingColumns());
        assertEquals(20, renamed.invalid());

        List<String> warnings = appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
        assertTrue(warnings.stream().anyMatch(m -> m.contains("receitas_candidatos_renamed.csv: header lacks required columns [VR_RECEITA]")), warnings::toString);
        assertTrue(warnings.stream().anyMatch(m -> m.contains("receitas_candidatos_blank_ids.csv: 12 of 12 rows miss required fields")), warnings::toString);
    }

    @Test
    void taxIdChecksumsWhenEnabled() throws Exception {
        TestFiles.write(dir, "receitas_candidatos_SP.csv", TestFiles.REVENUE_HEADER + "\n52998224725;SP;1\n12345678900;SP;1\n11.222.333/0001-81;SP;1\n");
        ProcessingReport report = processor(config().withValidateTaxIds(true), new CapturingSink(), new MetricRegistry()).run(dir);
        assertEquals(2, report.stats().validRecords());
        assertEquals(Map.of(Rejection.INVALID_TAX_ID, 1L), report.files().get(0).rejections());
    }

    private ProcessorConfig config() {
        return ProcessorConfig.defaults(dir);
    }

    private static BulkFinanceProcessor processor(ProcessorConfig cfg, Sink<FinanceRecord> sink, MetricRegistry registry) {
        TaxIdValidator taxIds = cfg.validateTaxIds() ? new BrazilianTaxIds() : TaxIdValidator.ANY;
        return new BulkFinanceProcessor(cfg, new FileClassifier(), new EncodingDetector(), new RecordValidator(taxIds),
                new ReportGenerator(cfg.topN(), cfg.expectedSubdivisions(), cfg.coverageThreshold(), cfg.volumeThreshold()), sink,
                new Metrics(registry));
    }
}
