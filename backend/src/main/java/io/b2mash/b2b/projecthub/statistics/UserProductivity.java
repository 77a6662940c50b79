package io.b2mash.b2b.projecthub.statistics;

import io.b2mash.b2b.projecthub.user.User;

/**
 * Activity of one organization member.
 *
 * @param averageCompletionHours mean hours from creation to completion of the member's DONE
 *     tasks; null when none is done
 * @param recentActivityCount comments written plus assigned tasks updated in the last seven days
 */
public record UserProductivity(
    User user,
    long totalAssignedTasks,
    long completedAssignedTasks,
    double completionRate,
    long commentsMade,
    long projectsInvolved,
    Double averageCompletionHours,
    long recentActivityCount) {}
