package com.herzen.tracker.blocking;

import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;

import java.util.List;

public class BlockingModels {
    public record BlockingResult(String taskId, String learnerId, boolean blocked, List<String> blockers) {
        public static BlockingResult clear(String taskId, String learnerId) {
            return new BlockingResult(taskId, learnerId, false, List.of());
        }
    }

    /**
     * One task responsible for a block. {@code blocks} is the task it holds up, {@code depth}
     * counts hops from the task that was asked about.
     */
    public record BlockingLink(String taskId, String blocks, int depth, TaskStatus status) {}

    public record BlockedTask(Task task, TaskStatus status, List<String> blockers) {}
}
