package com.trellis.dispatch.cli;

import com.trellis.core.model.Checkpoint;
import com.trellis.core.persistence.ThreadCheckpointer;
import com.trellis.core.persistence.ThreadNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: trellis timeline &lt;thread-id&gt;
 * <p>
 * Shows every checkpoint of a thread in sequence order, superseded ones included and
 * marked, so reverted branches stay visible.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show a thread's checkpoint timeline")
@Component
public class TimelineCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    private final ThreadCheckpointer checkpointer;

    public TimelineCommand(ThreadCheckpointer checkpointer) {
        this.checkpointer = checkpointer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Checkpoint> checkpoints;
        try {
            checkpoints = checkpointer.getFullHistory(threadId);
        } catch (ThreadNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (checkpoints.isEmpty()) {
            ConsoleOutput.error("No checkpoints found for thread: " + threadId);
            return;
        }

        ConsoleOutput.info("Timeline for thread " + threadId);
        System.out.println();
        System.out.printf("  %-5s %-20s %-38s %s%n", "SEQ", "PHASE", "CHECKPOINT ID", "CREATED");
        System.out.println("  " + "-".repeat(90));

        int superseded = 0;
        for (Checkpoint cp : checkpoints) {
            String marker = cp.superseded() ? " (superseded)" : "";
            if (cp.superseded()) {
                superseded++;
            }
            System.out.printf("  %-5d %-20s %-38s %s%s%n",
                    cp.sequence(), cp.phase().tag(), cp.checkpointId(), cp.createdAt(), marker);
        }

        System.out.println();
        ConsoleOutput.info(checkpoints.size() + " checkpoint" + (checkpoints.size() != 1 ? "s" : "")
                + " recorded" + (superseded > 0 ? ", " + superseded + " superseded by revert." : "."));
    }
}
