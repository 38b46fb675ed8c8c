package tickwork.scheduler.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches to a runner registered per job type.
 * Unknown job types fail the execution instead of throwing.
 */
public class RoutingJobRunner implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(RoutingJobRunner.class);

    private final Map<String, JobRunner> runners = new ConcurrentHashMap<>();

    /**
     * Register the runner for a job type, replacing any previous one.
     */
    public RoutingJobRunner register(String jobType, JobRunner runner) {
        JobRunner previous = runners.put(jobType, runner);
        if (previous != null) {
            log.warn("Replaced runner for job type {}", jobType);
        } else {
            log.debug("Registered runner for job type {}", jobType);
        }
        return this;
    }

    public Set<String> jobTypes() {
        return Set.copyOf(runners.keySet());
    }

    @Override
    public JobResult run(String jobType, Map<String, Object> jobConfig) throws Exception {
        JobRunner runner = runners.get(jobType);
        if (runner == null) {
            return JobResult.failure("No runner registered for job type: " + jobType);
        }
        return runner.run(jobType, jobConfig);
    }
}
