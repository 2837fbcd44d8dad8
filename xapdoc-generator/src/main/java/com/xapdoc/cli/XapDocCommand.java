package com.xapdoc.cli;

import com.xapdoc.model.GenerationError;
import com.xapdoc.model.GenerationResult;
import com.xapdoc.service.XapDocGenerator;
import com.xapdoc.util.DefinitionDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the documentation build on startup and turns its outcome into the process exit code.
 *
 * <p>On failure the cumulative definitions at the point of failure are logged for diagnosis.
 */
@Component
public class XapDocCommand implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(XapDocCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final XapDocGenerator generator;
    private final DefinitionDumper dumper;

    private volatile int exitCode = EXIT_OK;

    public XapDocCommand(XapDocGenerator generator, DefinitionDumper dumper) {
        this.generator = generator;
        this.dumper = dumper;
    }

    @Override
    public void run(String... args) {
        GenerationResult result = generator.generate();
        if (result.isSuccess()) {
            exitCode = EXIT_OK;
            return;
        }

        GenerationError error = result.error();
        log.error("Documentation generation failed: kind={}, layer={}, message={}",
                error.getKind(), error.getLayer(), error.getMessage());
        if (error.getState() != null) {
            log.error("Definitions at failure:\n{}", dumper.toJson(error.getState()));
        }
        exitCode = EXIT_FAILED;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
