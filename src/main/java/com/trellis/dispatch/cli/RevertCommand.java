package com.trellis.dispatch.cli;

import com.trellis.core.persistence.CheckpointNotFoundException;
import com.trellis.core.persistence.ThreadCheckpointer;
import com.trellis.core.persistence.ThreadNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: trellis revert &lt;thread-id&gt; &lt;checkpoint-id&gt;
 * <p>
 * Time-travels a thread back to an earlier checkpoint. Exit code 1 when the revert
 * is refused.
 */
@Command(name = "revert", mixinStandardHelpOptions = true, description = "Revert a thread to an earlier checkpoint")
@Component
public class RevertCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    @Parameters(index = "1", description = "Checkpoint ID to revert to")
    private String checkpointId;

    private final ThreadCheckpointer checkpointer;

    public RevertCommand(ThreadCheckpointer checkpointer) {
        this.checkpointer = checkpointer;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Map<String, Object> payload = checkpointer.revertToCheckpoint(threadId, checkpointId);
            ConsoleOutput.success("Thread " + threadId + " reverted to checkpoint " + checkpointId);
            ConsoleOutput.info("Restored state keys: " + (payload.isEmpty() ? "(none)" : payload.keySet()));
            return 0;
        } catch (ThreadNotFoundException | CheckpointNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (IllegalStateException e) {
            ConsoleOutput.error("Revert refused: " + e.getMessage());
        }
        return 1;
    }
}
