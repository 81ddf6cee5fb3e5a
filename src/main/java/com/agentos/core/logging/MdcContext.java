package com.agentos.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AgentOS MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String GOAL_ID = "goalId";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";

    private MdcContext() {}

    public static void setGoal(String goalId) {
        MDC.put(GOAL_ID, goalId);
    }

    public static void setTask(String goalId, String taskId) {
        MDC.put(GOAL_ID, goalId);
        MDC.put(TASK_ID, taskId);
    }

    public static void setWorker(String workerId) {
        MDC.put(WORKER_ID, workerId);
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }

    public static void clear() {
        MDC.remove(GOAL_ID);
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }
}
