package com.migratorx.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.migratorx.observability.SensitiveDataRedactor;
import com.migratorx.workflow.Finding;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link CommandReport} as indented JSON with sensitive metadata masked.
 */
@Component
public class ReportWriter {

    private final ObjectMapper mapper;
    private final SensitiveDataRedactor redactor;

    public ReportWriter(ObjectMapper mapper, SensitiveDataRedactor redactor) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.redactor = redactor;
    }

    public String render(CommandReport report) {
        List<ReportDocument.FindingView> findings = report.findings().stream()
                .map(redactor::redact)
                .map(ReportWriter::view)
                .toList();
        var summary = new ReportDocument.SummaryView(
                report.summary().info(), report.summary().warn(), report.summary().block());
        try {
            return mapper.writeValueAsString(new ReportDocument(summary, findings));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("failed to encode output", e);
        }
    }

    public void write(CommandReport report, PrintStream out) {
        out.println(render(report));
        out.flush();
    }

    private static ReportDocument.FindingView view(Finding finding) {
        return new ReportDocument.FindingView(finding.severity().name(), finding.message(), finding.metadata());
    }
}
