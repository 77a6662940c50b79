package io.b2mash.b2b.projecthub.organization;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code slug} is optional; one is derived from the name when omitted. */
public record CreateOrganizationInput(
    @NotBlank(message = "Organization name is required")
        @Size(min = 2, max = 100, message = "Organization name must be 2 to 100 characters long")
        String name,
    String slug,
    @NotBlank(message = "Contact email is required")
        @Email(message = "Invalid contact email format")
        String contactEmail,
    @Size(max = 1000, message = "Organization description cannot exceed 1000 characters")
        String description) {}
