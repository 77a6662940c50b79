package io.b2mash.b2b.projecthub.task;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.UUID;

public record CreateTaskInput(
    @NotNull(message = "Project ID is required for new tasks") UUID projectId,
    @NotBlank(message = "Task title is required")
        @Size(min = 2, max = 200, message = "Task title must be 2 to 200 characters long")
        String title,
    @Size(max = 2000, message = "Task description cannot exceed 2000 characters")
        String description,
    TaskStatus status,
    @Email(message = "Invalid assignee email format") String assigneeEmail,
    OffsetDateTime dueDate) {}
