package io.github.budgetcore.worker_pool;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void of_generatesIdAndCreationTime() {
        Instant before = Instant.now();
        Job job = Job.of("report", "payload");
        assertTrue(job.getId().startsWith("job_"));
        assertEquals("report", job.getType());
        assertEquals("payload", job.getPayload());
        assertEquals(0, job.getPriority());
        assertFalse(job.getCreated().isBefore(before));
    }

    @Test
    void builder_keepsExplicitValues() {
        Instant created = Instant.parse("2024-03-01T10:00:00Z");
        Job job = Job.builder().id("job-7").type("export").priority(5).created(created).build();
        assertEquals("job-7", job.getId());
        assertEquals(5, job.getPriority());
        assertEquals(created, job.getCreated());
    }
}
