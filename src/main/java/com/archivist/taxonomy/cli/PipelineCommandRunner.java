package com.archivist.taxonomy.cli;

import com.archivist.taxonomy.model.PipelineStage;
import com.archivist.taxonomy.model.ReclusterStats;
import com.archivist.taxonomy.pipeline.PipelineOrchestrator;
import com.archivist.taxonomy.pipeline.PipelineRunResult;
import com.archivist.taxonomy.service.BatchRecoveryService;
import com.archivist.taxonomy.service.BatchRecoveryService.RecoveryReport;
import com.archivist.taxonomy.service.BatchRecoveryService.RecoveryState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty("pipeline.command")
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PipelineOrchestrator orchestrator;
    private final BatchRecoveryService batchRecoveryService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        String command = single(args, "pipeline.command");
        try {
            exitCode = execute(command == null ? "" : command.strip(), args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments for '{}': {}", command, e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed: {}", command, e.getMessage(), e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(String command, ApplicationArguments args) {
        switch (command) {
            case "run" -> {
                return report(orchestrator.run(session(args)));
            }
            case "resume" -> {
                PipelineStage stage = PipelineStage.parse(single(args, "stage"));
                return report(orchestrator.runFromStage(session(args), stage, args.containsOption("force")));
            }
            case "reset" -> {
                UUID sessionId = session(args);
                orchestrator.reset(sessionId);
                log.info("Session {} reset", sessionId);
                return EXIT_OK;
            }
            case "recluster" -> {
                ReclusterStats stats = orchestrator.recluster(session(args));
                log.info("Re-clustering finished: {}", stats);
                return EXIT_OK;
            }
            case "recover" -> {
                List<RecoveryReport> reports = args.containsOption("handles")
                    ? batchRecoveryService.recover(handles(args))
                    : batchRecoveryService.recoverSession(session(args));
                reports.forEach(report -> log.info("{}", report));
                boolean anyFailed = reports.stream().anyMatch(report -> report.state() == RecoveryState.FAILED);
                return anyFailed ? EXIT_FAILED : EXIT_OK;
            }
            default -> throw new IllegalArgumentException(
                "Unknown command '" + command + "', expected run, resume, reset, recluster or recover");
        }
    }

    private static int report(PipelineRunResult result) {
        if (result.succeeded()) {
            log.info("Session {} finished with stages {} and stats {}",
                result.sessionId(), result.completedStages(), result.stats());
            return EXIT_OK;
        }
        log.error("Session {} ended in {}: {}", result.sessionId(),
            result.status() == null ? "unknown status" : result.status().dbValue(), result.error());
        return EXIT_FAILED;
    }

    private static UUID session(ApplicationArguments args) {
        String value = single(args, "session");
        if (value == null) {
            throw new IllegalArgumentException("--session is required");
        }
        return UUID.fromString(value.strip());
    }

    private static List<String> handles(ApplicationArguments args) {
        List<String> handles = args.getOptionValues("handles").stream()
            .flatMap(value -> Arrays.stream(value.split(",")))
            .map(String::strip)
            .filter(handle -> !handle.isEmpty())
            .toList();
        if (handles.isEmpty()) {
            throw new IllegalArgumentException("--handles needs at least one batch handle");
        }
        return handles;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
