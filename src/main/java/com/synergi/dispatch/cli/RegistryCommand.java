package com.synergi.dispatch.cli;

import com.synergi.core.model.WorkerEntry;
import com.synergi.core.registry.RegistrySort;
import com.synergi.core.registry.WorkerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: synergi registry
 */
@Command(name = "registry", mixinStandardHelpOptions = true, description = "List registered workers")
@Component
public class RegistryCommand implements Callable<Integer> {

    @Option(names = {"--category", "-c"}, description = "Only workers of this category")
    private String category;

    @Option(names = {"--sort", "-s"}, description = "efficiency, price, reputation or jobs (default: ${DEFAULT-VALUE})",
            defaultValue = "efficiency")
    private String sort;

    private final WorkerRegistry registry;

    public RegistryCommand(WorkerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RegistrySort order;
        try {
            order = RegistrySort.parse(sort);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid sort: " + sort + ". Valid: efficiency, price, reputation, jobs");
            return 2;
        }

        List<WorkerEntry> workers = registry.listAll(category, order);
        if (workers.isEmpty()) {
            ConsoleOutput.info(category != null ? "No workers in category " + category : "Registry is empty");
            return 0;
        }

        System.out.printf("  %-16s %-14s %-9s %-4s %-10s %-7s %s%n",
                "WORKER", "CATEGORY", "PRICE", "REP", "EFFICIENCY", "JOBS", "STATUS");
        System.out.println("  " + "-".repeat(72));
        for (WorkerEntry w : workers) {
            System.out.printf("  %-16s %-14s %-9s %-4d %-10.0f %-7s %s%n",
                    w.id(), w.category(), w.price().toPlainString(), w.reputation(), w.efficiency(),
                    w.jobsCompleted() + "/" + w.jobsFailed(), w.active() ? "active" : "inactive");
        }
        return 0;
    }
}
