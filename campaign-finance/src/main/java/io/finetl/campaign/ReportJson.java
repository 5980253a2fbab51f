package io.finetl.campaign;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** Structured form of a {@link ProcessingReport}. */
public final class ReportJson {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReportJson() {}

    public static ObjectNode toJson(ProcessingReport report) {
        AggregateStats s = report.stats();
        ObjectNode root = MAPPER.createObjectNode();
        root.put("cancelled", report.cancelled());
        root.put("wallTimeMillis", report.wallTime().toMillis());
        root.put("recordsPerSecond", report.recordsPerSecond());
        root.put("sinkFailures", report.sinkFailures());

        ObjectNode totals = root.putObject("totals");
        totals.put("filesProcessed", s.filesProcessed());
        totals.put("filesWithErrors", s.filesWithErrors());
        totals.put("filesFailed", s.filesFailed());
        totals.put("filesSkipped", report.skippedCount());
        totals.put("totalRecords", s.totalRecords());
        totals.put("validRecords", s.validRecords());
        totals.put("invalidRecords", s.invalidRecords());
        totals.put("cumulativeFileTimeMillis", s.cumulativeFileTime().toMillis());

        ObjectNode byType = root.putObject("byType");
        for (RecordType t : RecordType.values()) {
            ObjectNode n = byType.putObject(t.label());
            n.put("files", s.files(t));
            n.put("records", s.records(t));
            n.put("valid", s.valid(t));
            n.put("percentage", report.percentageByType().getOrDefault(t, 0.0));
            n.put("validAmount", s.validAmountByType().getOrDefault(t, BigDecimal.ZERO));
        }

        ObjectNode units = root.putObject("recordsByGeographicUnit");
        for (Map.Entry<String, Long> e : s.recordsByGeographicUnit().entrySet()) units.put(e.getKey(), e.getValue());
        ArrayNode top = root.putArray("topGeographicUnits");
        for (ProcessingReport.UnitCount u : report.topGeographicUnits()) {
            top.addObject().put("unit", u.unit()).put("records", u.records()).put("percentage", u.percentage());
        }

        ProcessingReport.Coverage c = report.coverage();
        root.putObject("coverage")
                .put("expectedFiles", c.expectedFiles())
                .put("filesProcessed", c.filesProcessed())
                .put("ratio", c.ratio())
                .put("threshold", c.threshold())
                .put("complete", c.complete());
        ProcessingReport.Volume v = report.volume();
        root.putObject("volume")
                .put("records", v.records())
                .put("threshold", v.threshold())
                .put("productionScale", v.productionScale());

        ArrayNode files = root.putArray("files");
        for (FileStats f : report.files()) files.add(file(f));
        ArrayNode skipped = root.putArray("skipped");
        for (Path p : report.skipped()) skipped.add(p.getFileName().toString());
        return root;
    }

    private static ObjectNode file(FileStats f) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("file", f.fileName());
        n.put("recordType", f.recordType().label());
        n.put("sizeBytes", f.sizeBytes());
        n.put("rows", f.rowsProcessed());
        n.put("valid", f.valid());
        n.put("invalid", f.invalid());
        n.put("validAmount", f.validAmount());
        n.put("elapsedMillis", f.elapsed().toMillis());
        f.detection().ifPresent(d -> {
            n.put("encoding", d.charset().name());
            n.put("delimiter", d.delimiter().name());
            n.put("lossy", d.lossy());
        });
        ObjectNode rejections = n.putObject("rejections");
        f.rejections().forEach((why, count) -> rejections.put(why.name(), count));
        n.put("distinctGeographicUnits", f.geographicUnits().size());
        ArrayNode missing = n.putArray("missingColumns");
        f.missingColumns().forEach(missing::add);
        n.put("schemaDriftSuspected", f.schemaDriftSuspected());
        f.error().ifPresent(e -> n.putObject("error")
                .put("kind", e.kind().name())
                .put("message", e.message())
                .put("atRow", e.atRow()));
        return n;
    }

    public static void write(ProcessingReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(target.toFile(), toJson(report));
    }
}
