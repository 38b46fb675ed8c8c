package tickwork.scheduler.executor;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class JobResultTest {

    @Test
    void okResultsCarryOptionalPayload() {
        JobResult plain = JobResult.ok();
        JobResult withPayload = JobResult.ok("42 rows");

        assertTrue(plain.success());
        assertNull(plain.payload());
        assertTrue(withPayload.success());
        assertEquals("42 rows", withPayload.payload());
        assertNull(withPayload.error());
    }

    @Test
    void failureAlwaysHasAnError() {
        assertFalse(JobResult.failure("disk full").success());
        assertEquals("disk full", JobResult.failure("disk full").error());
        assertEquals("Unknown error", JobResult.failure(null).error());
    }
}
