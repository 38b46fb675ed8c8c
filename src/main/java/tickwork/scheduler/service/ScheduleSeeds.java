package tickwork.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import tickwork.scheduler.error.SchedulingException;
import tickwork.scheduler.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads job definitions from a JSON array of {@link CreateScheduleRequest}s
 * and registers them, so a scheduler can start with a known set of jobs.
 *
 * <pre>
 * [
 *   {"name": "nightly report", "job_type": "report", "schedule_type": "RECURRING",
 *    "recurrence": {"frequency": "DAILY", "time_of_day": "02:00"}, "priority": "HIGH"}
 * ]
 * </pre>
 */
public final class ScheduleSeeds {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSeeds.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<CreateScheduleRequest>> REQUESTS = new TypeReference<>() {
    };

    private ScheduleSeeds() {
    }

    public static List<CreateScheduleRequest> parse(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, REQUESTS);
    }

    public static List<CreateScheduleRequest> read(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static String write(List<CreateScheduleRequest> requests) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(requests);
    }

    /**
     * Register every request for one owner. An invalid entry is logged and
     * skipped; the others are still created.
     *
     * @return the jobs created
     */
    public static List<ScheduledJob> register(ScheduleRegistry registry, String ownerId,
            List<CreateScheduleRequest> requests) {
        List<ScheduledJob> created = new ArrayList<>();
        for (CreateScheduleRequest request : requests) {
            try {
                created.add(registry.create(ownerId, request));
            } catch (SchedulingException e) {
                log.warn("Seed schedule '{}' rejected: {}", request.name(), e.getMessage());
            }
        }
        log.info("Seeded {} of {} schedules for owner {}", created.size(), requests.size(), ownerId);
        return created;
    }
}
