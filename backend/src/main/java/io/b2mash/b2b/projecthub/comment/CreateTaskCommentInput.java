package io.b2mash.b2b.projecthub.comment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CreateTaskCommentInput(
    @NotNull(message = "Task ID is required for new comments") UUID taskId,
    @NotBlank(message = "Comment content is required")
        @Size(max = 2000, message = "Comment content cannot exceed 2000 characters")
        String content) {}
