package io.b2mash.b2b.projecthub.user;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterInput(
    @NotBlank(message = "Email is required") @Email(message = "Invalid email format")
        String email,
    @NotBlank(message = "Password is required")
        @Size(min = 8, message = "Password must be at least 8 characters long")
        String password,
    @NotBlank(message = "First name is required")
        @Size(max = 150, message = "First name cannot exceed 150 characters")
        String firstName,
    @NotBlank(message = "Last name is required")
        @Size(max = 150, message = "Last name cannot exceed 150 characters")
        String lastName) {}
