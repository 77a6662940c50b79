package io.b2mash.b2b.projecthub.comment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateTaskCommentInput(
    @NotBlank(message = "Comment content is required")
        @Size(max = 2000, message = "Comment content cannot exceed 2000 characters")
        String content) {}
