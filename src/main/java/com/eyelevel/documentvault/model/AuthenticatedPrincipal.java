package com.eyelevel.documentvault.model;

import org.springframework.lang.Nullable;

/**
 * The caller on whose behalf a document operation runs, as established by the authentication layer.
 *
 * @param householdId household shared with other principals, or {@code null}.
 */
public record AuthenticatedPrincipal(String id, SubscriptionTier tier, @Nullable String householdId) {

    /**
     * @return whether this principal may read a document owned by {@code ownerId} in {@code ownerHouseholdId}.
     */
    public boolean canAccess(String ownerId, @Nullable String ownerHouseholdId) {
        return id.equals(ownerId) || (householdId != null && householdId.equals(ownerHouseholdId));
    }
}
