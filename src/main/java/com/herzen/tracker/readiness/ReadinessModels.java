package com.herzen.tracker.readiness;

import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;

import java.util.Comparator;

public class ReadinessModels {
    public record ReadyWorkItem(Task task, TaskStatus status, int depth) {
        /**
         * Started work first, then priority, depth, age and id. Ids are unique so no two items
         * ever compare equal.
         */
        public static final Comparator<ReadyWorkItem> ORDER = Comparator
                .comparingInt((ReadyWorkItem i) -> i.status() == TaskStatus.IN_PROGRESS ? 0 : 1)
                .thenComparingInt(i -> i.task().priority())
                .thenComparingInt(ReadyWorkItem::depth)
                .thenComparing(i -> i.task().createdAt(), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(i -> i.task().id());
    }
}
