package eu.virtualparadox.laysum.summary.job;

import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.pipeline.PipelineStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SummaryJobRegistryTest {

    private final SummaryJobRegistry registry = new SummaryJobRegistry();

    @Test
    @DisplayName("New jobs get increasing ids and start QUEUED")
    void createJob() {
        SummaryJob first = registry.createJob("a", SummaryMode.MICRO);
        SummaryJob second = registry.createJob("b", SummaryMode.EXTENDED);

        assertTrue(second.getId() > first.getId());
        assertEquals(ESummaryStatus.QUEUED, first.getStatus());
        assertSame(first, registry.getJob(first.getId()).orElseThrow());
        assertNotNull(first.getCreatedAt());
    }

    @Test
    @DisplayName("Status updates and failures are recorded on the job")
    void transitions() {
        SummaryJob job = registry.createJob("a", SummaryMode.MICRO);

        registry.updateStatus(job.getId(), ESummaryStatus.VERIFYING);
        assertEquals(ESummaryStatus.VERIFYING, job.getStatus());
        assertFalse(job.getStatus().isTerminal());

        registry.fail(job.getId(), "boom");
        assertEquals(ESummaryStatus.FAILED, job.getStatus());
        assertEquals("boom", job.getError());
        assertTrue(job.getStatus().isTerminal());
    }

    @Test
    @DisplayName("Updating an unknown job is a no-op")
    void unknown() {
        registry.updateStatus(99, ESummaryStatus.RANKING);
        assertTrue(registry.getJob(99).isEmpty());
    }

    @Test
    @DisplayName("Pipeline stages map onto job statuses")
    void stageMapping() {
        for (PipelineStage stage : PipelineStage.values()) {
            assertEquals(stage.name(), ESummaryStatus.of(stage).name());
        }
    }
}
