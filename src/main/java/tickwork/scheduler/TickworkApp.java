package tickwork.scheduler;

import tickwork.scheduler.config.Dependencies;
import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.executor.JobResult;
import tickwork.scheduler.executor.RoutingJobRunner;
import tickwork.scheduler.service.ScheduleSeeds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point: runs a scheduler until the process is stopped.
 *
 * Without {@code --config} settings come from TICKWORK_* environment
 * variables. Only the built-in "log" job type is runnable out of the box;
 * embedders register their own runners on a {@link RoutingJobRunner}.
 */
@Command(name = "tickwork", mixinStandardHelpOptions = true,
        description = "Run the recurring job scheduler until the process is stopped")
public final class TickworkApp implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TickworkApp.class);

    @Option(names = {"--config"}, description = "INI settings file")
    Path configPath;

    @Option(names = {"--seed"}, description = "JSON file of schedules to register at startup")
    Path seedPath;

    @Option(names = {"--owner"}, description = "Owner of the seeded schedules", defaultValue = "local")
    String ownerId;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TickworkApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Dependencies deps = Dependencies.create(loadConfig(), defaultRunner());
        if (seedPath != null) {
            try {
                ScheduleSeeds.register(deps.registry(), ownerId, ScheduleSeeds.read(seedPath));
            } catch (IOException e) {
                deps.close();
                throw e;
            }
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            deps.close();
            stopped.countDown();
        }, "tickwork-shutdown"));

        deps.startDriver();
        log.info("Tickwork scheduler running");
        stopped.await();
        return 0;
    }

    SchedulerConfig loadConfig() throws IOException {
        return configPath != null ? SchedulerConfig.fromIni(configPath) : SchedulerConfig.fromEnv();
    }

    static RoutingJobRunner defaultRunner() {
        return new RoutingJobRunner()
                .register("log", (jobType, jobConfig) -> {
                    log.info("log job ran with config {}", jobConfig);
                    return JobResult.ok();
                });
    }
}
