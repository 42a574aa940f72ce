package com.chatrelay.server.store;

import com.chatrelay.server.model.TaskSnapshot;

import java.util.Optional;

public interface TaskStore {

    /** True when the user created the task or is its assignee. */
    boolean canAccessTask(String userId, String taskId);

    Optional<TaskSnapshot> findTask(String taskId);
}
