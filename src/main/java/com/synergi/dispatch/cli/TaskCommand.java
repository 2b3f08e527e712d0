package com.synergi.dispatch.cli;

import com.synergi.core.engine.InvalidTaskException;
import com.synergi.core.engine.TaskEngine;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.StepStatus;
import com.synergi.core.model.TaskResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.math.BigDecimal;
import java.util.concurrent.Callable;

/**
 * CLI command: synergi task "&lt;text&gt;"
 * <p>
 * Runs a task in-process against the configured registry and prints every step,
 * every payment and the synthesized answer.
 */
@Command(name = "task", mixinStandardHelpOptions = true, description = "Run a task under a budget")
@Component
public class TaskCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language task")
    private String text;

    @Option(names = {"--budget", "-b"}, description = "Spending cap for this task (default: configured)")
    private BigDecimal budget;

    @Option(names = {"--requester", "-r"}, description = "Payer id for direct hires (default: ${DEFAULT-VALUE})",
            defaultValue = "cli")
    private String requester;

    private final TaskEngine taskEngine;

    public TaskCommand(TaskEngine taskEngine) {
        this.taskEngine = taskEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Planning task...");

        TaskResult result;
        try {
            result = taskEngine.runTask(text, budget, requester);
        } catch (InvalidTaskException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Task failed: " + rootCauseMessage(e));
            return 1;
        }

        ExecutionTrace trace = result.trace();
        System.out.println();
        System.out.println("TASK " + trace.taskId());
        System.out.println("Plan (" + result.plannedBy() + "): " + result.planReasoning());
        System.out.println();
        for (StepOutcome outcome : trace.outcomes()) {
            ConsoleOutput.step(outcome);
        }

        System.out.println();
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(String.format("Cost: %s of %s (delegated %s, depth %d)",
                trace.cumulativeCost().toPlainString(), trace.budgetLimit().toPlainString(),
                trace.delegatedCost().toPlainString(), trace.maxDepth()));
        if (trace.cancelled()) {
            ConsoleOutput.warn("Task was cancelled before all steps finished");
        }
        System.out.println();
        System.out.println(result.finalAnswer());

        return trace.count(StepStatus.SUCCESS) + trace.count(StepStatus.DEGRADED) > 0 ? 0 : 1;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
