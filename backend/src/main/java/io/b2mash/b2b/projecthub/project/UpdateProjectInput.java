package io.b2mash.b2b.projecthub.project;

import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record UpdateProjectInput(
    @Size(min = 2, max = 200, message = "Project name must be 2 to 200 characters long")
        String name,
    @Size(max = 2000, message = "Project description cannot exceed 2000 characters")
        String description,
    ProjectStatus status,
    LocalDate dueDate) {}
