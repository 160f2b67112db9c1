package net.papermentat.support.report;

import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import net.papermentat.model.ProcessingState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultReportServiceTest {

    private final ResultReportService service = new ResultReportService();

    private static ProcessingResult completed(String journal, OaStatus status, OaEvidence evidence) {
        PaperMetadata metadata = PaperMetadata.builder()
            .title("Paper in " + journal)
            .journal(journal)
            .oaStatus(status)
            .oaLocation("https://example.org/" + journal + ".pdf")
            .oaEvidence(evidence)
            .build();
        return ProcessingResult.completed("", metadata, Duration.ZERO);
    }

    private static ProcessingResult failed() {
        return new ProcessingResult("10.1000/x", ProcessingState.FAILED, null, "DOI not found in Crossref",
            Duration.ZERO, 0);
    }

    @Test
    @DisplayName("empty result set yields the no-results message")
    void emptyResults() {
        assertThat(service.generateReport(List.of())).isEqualTo(ResultReportService.EMPTY_REPORT);
        assertThat(service.generateReport(null)).isEqualTo(ResultReportService.EMPTY_REPORT);
    }

    @Test
    @DisplayName("all-failed set reports a zero success rate")
    void allFailed() {
        String report = service.generateReport(List.of(failed(), failed()));

        assertThat(report)
            .contains("Total processed: 2")
            .contains("Completed:       0")
            .contains("Failed:          2")
            .contains("Success rate:    0%")
            .doesNotContain("Top Journals:");
    }

    @Test
    @DisplayName("report counts OA colors, flags inferred ones and ranks journals")
    void mixedResults() {
        String report = service.generateReport(List.of(
            completed("Nature", OaStatus.GOLD, OaEvidence.OA_STATUS_INDEX),
            completed("Science", OaStatus.GREEN, OaEvidence.CITATION_INDEX_FLAG),
            completed("Science", OaStatus.GREEN, OaEvidence.PREPRINT_ARCHIVE),
            completed("Cell", OaStatus.GREEN, OaEvidence.OA_STATUS_INDEX),
            failed()));

        assertThat(report)
            .contains("Success rate:    80%")
            .contains("  gold: 1")
            .contains("  green: 3")
            .contains("  Inferred OA (flag only): 1");
        assertThat(report.indexOf("  gold: 1")).isLessThan(report.indexOf("  green: 3"));
        // ties keep first-seen order
        assertThat(report.indexOf("  Science: 2")).isLessThan(report.indexOf("  Nature: 1"));
        assertThat(report.indexOf("  Nature: 1")).isLessThan(report.indexOf("  Cell: 1"));
    }
}
