package com.trellis.dispatch.cli;

import com.trellis.core.model.ExecutionThread;
import com.trellis.core.persistence.ThreadCheckpointer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: trellis threads
 * <p>
 * Lists execution threads from the checkpoint store: id, status, namespace and
 * number of visible checkpoints.
 */
@Command(name = "threads", mixinStandardHelpOptions = true, description = "List execution threads")
@Component
public class ThreadsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = "--active", description = "Only show threads that are still open")
    private boolean activeOnly;

    private final ThreadCheckpointer checkpointer;

    public ThreadsCommand(ThreadCheckpointer checkpointer) {
        this.checkpointer = checkpointer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ExecutionThread> threads = checkpointer.listThreads().stream()
                .filter(t -> !activeOnly || t.isActive())
                .toList();
        if (threads.isEmpty()) {
            ConsoleOutput.info("No threads found.");
            return;
        }

        // newest last, show the tail
        List<ExecutionThread> display = threads.size() > limit
                ? threads.subList(threads.size() - limit, threads.size())
                : threads;

        ConsoleOutput.info("Threads (" + display.size() + " of " + threads.size() + "):");
        System.out.println();
        System.out.printf("  %-44s %-8s %-20s %s%n", "THREAD ID", "STATUS", "NAMESPACE", "CHECKPOINTS");
        System.out.println("  " + "-".repeat(84));

        for (ExecutionThread thread : display) {
            System.out.printf("  %-44s %-8s %-20s %d%n",
                    ConsoleOutput.truncate(thread.threadId(), 44),
                    thread.status().name(),
                    ConsoleOutput.truncate(thread.namespace(), 20),
                    checkpointer.countCheckpoints(thread.threadId()));
        }
    }
}
