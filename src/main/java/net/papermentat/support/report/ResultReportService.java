package net.papermentat.support.report;

import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import net.papermentat.model.ProcessingState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders aggregate statistics over a result set as plain text.
 */
@Service
public class ResultReportService {

    static final String EMPTY_REPORT = "No results to report.";
    private static final int TOP_VENUES = 10;

    public String generateReport(List<ProcessingResult> results) {
        if (results == null || results.isEmpty()) {
            return EMPTY_REPORT;
        }
        int total = results.size();
        int completed = 0;
        int failed = 0;
        int inferred = 0;
        Map<String, Integer> oaCounts = new TreeMap<>();
        Map<String, Integer> venueCounts = new LinkedHashMap<>();

        for (ProcessingResult result : results) {
            if (result.state() == ProcessingState.COMPLETED) {
                completed++;
            } else if (result.state() == ProcessingState.FAILED) {
                failed++;
            }
            PaperMetadata metadata = result.metadata();
            if (metadata == null) {
                continue;
            }
            OaStatus status = metadata.oaStatus();
            if (status != null) {
                oaCounts.merge(status.value(), 1, Integer::sum);
                if (metadata.isOaStatusInferred()) {
                    inferred++;
                }
            }
            if (metadata.journal() != null) {
                venueCounts.merge(metadata.journal(), 1, Integer::sum);
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add("Academic Paper Search Report");
        lines.add("=".repeat(40));
        lines.add(String.format(Locale.ROOT, "Total processed: %d", total));
        lines.add(String.format(Locale.ROOT, "Completed:       %d", completed));
        lines.add(String.format(Locale.ROOT, "Failed:          %d", failed));
        lines.add(String.format(Locale.ROOT, "Success rate:    %.0f%%", completed * 100.0 / total));
        lines.add("");
        lines.add("Open Access Breakdown:");
        oaCounts.forEach((status, count) -> lines.add("  " + status + ": " + count));
        if (inferred > 0) {
            lines.add("  Inferred OA (flag only): " + inferred);
        }
        if (!venueCounts.isEmpty()) {
            lines.add("");
            lines.add("Top Journals:");
            // stable sort keeps first-seen order among equal counts
            venueCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_VENUES)
                .forEach(entry -> lines.add("  " + entry.getKey() + ": " + entry.getValue()));
        }
        return String.join("\n", lines);
    }
}
