package com.acme.autodoist.spi;

import com.acme.autodoist.todoist.Comment;
import com.acme.autodoist.todoist.Task;
import java.util.List;
import java.util.Map;

/**
 * Read and delete access to the task tracker plus outbound notification delivery.
 * Failures surface as {@link com.acme.autodoist.core.TaskApiException}.
 */
public interface TaskClient {
    Task getTask(String taskId);

    List<Comment> listCommentsForTask(String taskId);

    List<Task> listActiveTasksForProject(String projectId);

    List<Task> listAllActiveTasks();

    void deleteComment(String commentId);

    void deleteTask(String taskId);

    int postWebhook(String url, Map<String, Object> payload, String bearerToken);
}
