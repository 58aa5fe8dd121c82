package triage.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationResultTest {

    @Test
    void fromRankedUsesFirstLabelAsPrediction() {
        ClassificationResult r = ClassificationResult.fromRanked("printer jammed", List.of(
                new LabelScore("hardware", 0.7),
                new LabelScore("billing", 0.2),
                new LabelScore("other", 0.1)));

        assertEquals("printer jammed", r.item());
        assertEquals("hardware", r.predicted());
        assertEquals(List.of("hardware", "billing", "other"), List.copyOf(r.scores().keySet()));
        assertEquals(0.2, r.scores().get("billing"));
    }

    @Test
    void fromRankedRejectsEmptyAnswer() {
        assertThrows(IllegalArgumentException.class, () -> ClassificationResult.fromRanked("x", List.of()));
    }

    @Test
    void rankedSortsHighestFirst() {
        List<LabelScore> ranked = LabelScore.ranked(List.of(
                new LabelScore("a", 0.1),
                new LabelScore("b", 0.6),
                new LabelScore("c", 0.3)));

        assertEquals(List.of("b", "c", "a"), ranked.stream().map(LabelScore::label).toList());
    }

    @Test
    void outcomeMustBeTerminal() {
        assertThrows(IllegalArgumentException.class,
                () -> new JobOutcome(JobState.PROCESSING, null, null, null, 0));
        assertEquals(JobState.ABORTED, JobOutcome.aborted("log", 1).status());
    }
}
