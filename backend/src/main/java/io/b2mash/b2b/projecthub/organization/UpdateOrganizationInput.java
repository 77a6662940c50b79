package io.b2mash.b2b.projecthub.organization;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateOrganizationInput(
    @Size(min = 2, max = 100, message = "Organization name must be 2 to 100 characters long")
        String name,
    @Email(message = "Invalid contact email format") String contactEmail,
    @Size(max = 1000, message = "Organization description cannot exceed 1000 characters")
        String description) {}
