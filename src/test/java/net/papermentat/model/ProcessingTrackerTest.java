package net.papermentat.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingTrackerTest {

    private static PaperMetadata paper(String location) {
        return PaperMetadata.builder()
            .title("Attention Is All You Need")
            .doi("10.48550/arxiv.1706.03762")
            .oaStatus(location != null ? OaStatus.GREEN : null)
            .oaLocation(location)
            .oaEvidence(location != null ? OaEvidence.OA_STATUS_INDEX : null)
            .build();
    }

    @Test
    @DisplayName("record with a location completes")
    void resolvedWithLocation_completes() {
        ProcessingResult result = ProcessingTracker.start("10.48550/arxiv.1706.03762")
            .resolved(paper("https://arxiv.org/pdf/1706.03762"))
            .finish(2);

        assertThat(result.state()).isEqualTo(ProcessingState.COMPLETED);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(result.metadata().oaLocation()).isEqualTo("https://arxiv.org/pdf/1706.03762");
    }

    @Test
    @DisplayName("record without a location stays at metadata_extracted")
    void resolvedWithoutLocation_staysExtracted() {
        ProcessingTracker tracker = ProcessingTracker.start("x");
        tracker.metadataExtracted(paper(null));
        tracker.resolved(paper(null));

        ProcessingResult result = tracker.finish(0);

        assertThat(result.state()).isEqualTo(ProcessingState.METADATA_EXTRACTED);
        assertThat(result.metadata()).isNotNull();
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    @DisplayName("failure after extraction keeps the metadata and the message")
    void failAfterExtraction_keepsMetadata() {
        ProcessingResult result = ProcessingTracker.start("x")
            .metadataExtracted(paper(null))
            .fail("boom")
            .finish(0);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.errorMessage()).isEqualTo("boom");
        assertThat(result.metadata()).isNotNull();
    }

    @Test
    @DisplayName("failure after triage carries no metadata")
    void failAfterTriage_hasNoMetadata() {
        ProcessingResult result = ProcessingTracker.start("https://example.org/page")
            .triaged()
            .fail(null)
            .finish(0);

        assertThat(result.metadata()).isNull();
        assertThat(result.errorMessage()).isEqualTo("Processing failed");
    }

    @Test
    @DisplayName("backward transitions are rejected")
    void backwardTransition_throws() {
        ProcessingTracker tracker = ProcessingTracker.start("x").metadataExtracted(paper(null));

        assertThatThrownBy(tracker::triaged).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a finished tracker is single-use")
    void finishedTracker_rejectsFurtherUse() {
        ProcessingTracker tracker = ProcessingTracker.start("x");
        tracker.finish(0);

        assertThatThrownBy(() -> tracker.fail("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tracker.finish(0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("elapsed time is measured from start to finish")
    void elapsed_isMeasured() {
        AtomicLong clock = new AtomicLong(10L);
        ProcessingTracker tracker = ProcessingTracker.start("x", clock::get);
        clock.addAndGet(Duration.ofMillis(1500).toNanos());

        assertThat(tracker.finish(0).elapsed()).isEqualTo(Duration.ofMillis(1500));
    }
}
