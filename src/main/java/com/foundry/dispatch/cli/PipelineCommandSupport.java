package com.foundry.dispatch.cli;

import com.foundry.core.engine.PipelineEngine;
import com.foundry.core.engine.PipelineException;
import com.foundry.core.events.EventBus;
import com.foundry.core.model.PipelineReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Shared execution of the {@code run} and {@code recover} commands: streams events to
 * the console, installs a shutdown hook for operator interrupts and prints the report.
 */
final class PipelineCommandSupport {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommandSupport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPLETED_WITH_FAILURES = 2;
    static final int EXIT_FAILED = 1;

    private PipelineCommandSupport() {}

    static int execute(PipelineEngine engine, EventBus eventBus, Duration gracefulTimeout,
                       boolean quiet, Supplier<PipelineReport> pipeline) {
        EventBus.Subscription subscription = quiet ? () -> { } : eventBus.subscribe(ConsoleOutput::event);
        Thread shutdownHook = new Thread(() -> {
            log.info("Interrupt received, shutting down");
            engine.shutdown(gracefulTimeout);
        }, "foundry-shutdown");
        boolean hookInstalled = installHook(shutdownHook);
        try {
            PipelineReport report = pipeline.get();
            ConsoleOutput.report(report);
            return PipelineReport.COMPLETED.equals(report.outcome()) ? EXIT_OK : EXIT_COMPLETED_WITH_FAILURES;
        } catch (PipelineException e) {
            ConsoleOutput.error("Pipeline failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
            if (hookInstalled) {
                removeHook(shutdownHook);
            }
        }
    }

    private static boolean installHook(Thread hook) {
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            return true;
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, no hook installed");
            return false;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutting down, hook stays registered");
        }
    }
}
