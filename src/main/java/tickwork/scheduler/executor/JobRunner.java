package tickwork.scheduler.executor;

import java.util.Map;

/**
 * The work a scheduled job performs. The scheduler treats job type and config
 * as opaque and hands them to the runner unchanged.
 *
 * A runner may report failure through {@link JobResult#failure(String)} or by
 * throwing; the executor records both as a FAILED execution.
 */
@FunctionalInterface
public interface JobRunner {

    JobResult run(String jobType, Map<String, Object> jobConfig) throws Exception;
}
