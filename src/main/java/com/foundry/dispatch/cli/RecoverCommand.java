package com.foundry.dispatch.cli;

import com.foundry.core.config.FoundryProperties;
import com.foundry.core.engine.PipelineEngine;
import com.foundry.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: foundry recover &lt;plan&gt;
 * <p>
 * Resumes a pipeline interrupted by a crash. Work items left IN_PROGRESS are reset to
 * PENDING and run again; merged milestones are skipped.
 */
@Command(name = "recover", mixinStandardHelpOptions = true, description = "Resume an interrupted pipeline")
@Component
public class RecoverCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the JSON plan file, used when work is not yet decomposed")
    private String plan;

    @Option(names = {"--quiet", "-q"}, description = "Do not print pipeline events")
    private boolean quiet;

    private final PipelineEngine engine;
    private final EventBus eventBus;
    private final FoundryProperties properties;

    public RecoverCommand(PipelineEngine engine, EventBus eventBus, FoundryProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Recovering pipeline from " + properties.getDatabasePath());
        return PipelineCommandSupport.execute(engine, eventBus, properties.getGracefulTimeout(), quiet,
                () -> engine.recover(plan));
    }
}
