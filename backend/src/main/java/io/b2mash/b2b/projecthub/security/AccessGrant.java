package io.b2mash.b2b.projecthub.security;

import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;

/**
 * Result of a passed access check. {@code tenant} is null only when no tenant-requiring policy was
 * checked.
 */
public record AccessGrant(Principal principal, Tenant tenant) {}
