package io.b2mash.b2b.projecthub.user;

import jakarta.validation.constraints.NotBlank;

public record LoginInput(
    @NotBlank(message = "Email is required") String email,
    @NotBlank(message = "Password is required") String password,
    String organizationSlug) {}
