package com.tapas.qb.etl.runner;

import com.tapas.qb.etl.domain.LoadMode;
import com.tapas.qb.etl.exception.EtlException;
import com.tapas.qb.etl.service.PipelineOrchestrator;
import com.tapas.qb.etl.service.PipelineRunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the warehouse load once at startup. {@code --mode=full|incremental}
 * overrides {@code etl.load-mode}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String MODE_OPTION = "mode";

    private final PipelineOrchestrator orchestrator;
    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        try {
            LoadMode mode = resolveMode(args);
            PipelineRunReport report = mode == null ? orchestrator.run() : orchestrator.run(mode);
            log.info("Run {} finished in state {}", report.getRunId(), report.getState());
            exitCode = 0;
        } catch (EtlException e) {
            log.error("Warehouse load failed: {}", e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid --{} argument: {}", MODE_OPTION, e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static LoadMode resolveMode(ApplicationArguments args) {
        List<String> values = args.getOptionValues(MODE_OPTION);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return LoadMode.fromString(values.get(values.size() - 1));
    }
}
