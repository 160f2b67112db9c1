package net.papermentat.runner;

import net.papermentat.config.PaperMentatProperties;
import net.papermentat.model.ProcessingResult;
import net.papermentat.service.PaperResolutionOrchestrator;
import net.papermentat.support.report.ResultJsonExporter;
import net.papermentat.support.report.ResultReportService;
import net.papermentat.support.retrieval.ArtifactDownloadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Console entry point.
 *
 * <p>Options: {@code --query=}, {@code --topics=a,b}, {@code --paper-list=} or {@code --fulltext=}
 * select the operation; {@code --max-results=} (default 50), {@code --download},
 * {@code --output=} and {@code --report-only} (skips the JSON export) shape what happens
 * with the results. {@code --topics} without a value searches the configured topics of interest.</p>
 */
@Component
public class PaperSearchRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PaperSearchRunner.class);
    static final int DEFAULT_MAX_RESULTS = 50;

    private final ApplicationArguments arguments;
    private final PaperResolutionOrchestrator orchestrator;
    private final ResultReportService reportService;
    private final ResultJsonExporter jsonExporter;
    private final ArtifactDownloadService downloadService;
    private final PaperMentatProperties properties;

    public PaperSearchRunner(ApplicationArguments arguments,
                             PaperResolutionOrchestrator orchestrator,
                             ResultReportService reportService,
                             ResultJsonExporter jsonExporter,
                             ArtifactDownloadService downloadService,
                             PaperMentatProperties properties) {
        this.arguments = arguments;
        this.orchestrator = orchestrator;
        this.reportService = reportService;
        this.jsonExporter = jsonExporter;
        this.downloadService = downloadService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        long requestedMax = parseLongOption("max-results", DEFAULT_MAX_RESULTS);
        int maxResults = DEFAULT_MAX_RESULTS;
        if (requestedMax > 0 && requestedMax <= Integer.MAX_VALUE) {
            maxResults = (int) requestedMax;
        } else {
            log.warn("--max-results must be between 1 and {}, using {}", Integer.MAX_VALUE, DEFAULT_MAX_RESULTS);
        }

        List<ProcessingResult> results;
        if (arguments.containsOption("query")) {
            results = orchestrator.searchAdHoc(requiredValue("query"), maxResults);
        } else if (arguments.containsOption("topics")) {
            results = searchTopics(maxResults);
        } else if (arguments.containsOption("paper-list")) {
            results = orchestrator.processPaperList(Path.of(requiredValue("paper-list")));
        } else if (arguments.containsOption("fulltext")) {
            results = orchestrator.searchFullTextRepository(requiredValue("fulltext"), maxResults);
        } else {
            return;
        }

        log.info("\n{}", reportService.generateReport(results));
        if (arguments.containsOption("download")) {
            int downloaded = downloadService.downloadArtifacts(results);
            log.info("Downloaded {} PDF(s)", downloaded);
        }
        if (arguments.containsOption("report-only")) {
            return;
        }
        Path saved = jsonExporter.write(results, optionValue("output"));
        log.info("Results written to {}", saved);
    }

    /**
     * Explicit topics share the result budget; configured topics each get the full budget.
     */
    private List<ProcessingResult> searchTopics(int maxResults) {
        String raw = optionValue("topics");
        if (!StringUtils.hasText(raw)) {
            log.info("No topics given, using configured topics of interest");
            return orchestrator.searchByTopics(properties.getTopicsOfInterest(), maxResults);
        }
        List<String> topics = Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .toList();
        if (topics.isEmpty()) {
            return List.of();
        }
        return orchestrator.searchByTopics(topics, Math.max(1, maxResults / topics.size()));
    }

    private String requiredValue(String option) {
        String value = optionValue(option);
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("Missing value for --" + option);
        }
        return value;
    }

    private String optionValue(String option) {
        if (!arguments.containsOption(option)) {
            return null;
        }
        List<String> values = arguments.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private long parseLongOption(String option, long defaultValue) {
        String raw = optionValue(option);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Invalid numeric value for --{} ({}). Using default {}.", option, raw, defaultValue);
            return defaultValue;
        }
    }
}
