package triage.orchestrator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStateTest {

    @Test
    void terminalAndActiveArePartition() {
        for (JobState s : JobState.values()) {
            assertNotEquals(s.isTerminal(), s.isActive(), s.name());
        }
        assertTrue(JobState.QUEUED.isActive());
        assertTrue(JobState.PROCESSING.isActive());
        assertTrue(JobState.COMPLETED.isTerminal());
        assertTrue(JobState.FAILED.isTerminal());
        assertTrue(JobState.ABORTED.isTerminal());
    }

    @Test
    void serializesAsLowercase() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"processing\"", mapper.writeValueAsString(JobState.PROCESSING));
        assertEquals("\"aborted\"", mapper.writeValueAsString(JobState.ABORTED));
    }
}
