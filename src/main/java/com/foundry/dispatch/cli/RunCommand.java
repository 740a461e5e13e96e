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
 * CLI command: foundry run &lt;plan&gt;
 * <p>
 * Plans and executes a new pipeline from a JSON plan file.
 * Exits 0 when every work item merged, 2 when some were escalated, 1 on failure.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a new pipeline")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the JSON plan file")
    private String plan;

    @Option(names = {"--quiet", "-q"}, description = "Do not print pipeline events")
    private boolean quiet;

    private final PipelineEngine engine;
    private final EventBus eventBus;
    private final FoundryProperties properties;

    public RunCommand(PipelineEngine engine, EventBus eventBus, FoundryProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Running plan " + plan + " with " + properties.getMaxWorkers() + " worker(s)");
        return PipelineCommandSupport.execute(engine, eventBus, properties.getGracefulTimeout(), quiet,
                () -> engine.run(plan));
    }
}
