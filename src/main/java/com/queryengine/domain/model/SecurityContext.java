package com.queryengine.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Resolved row-level security for a single request.
 *
 * Produced by the authorization layer once per request and never persisted
 * by the engine. The tenant and sub-entity sets are copied on construction so
 * the context stays immutable for the lifetime of the request.
 */
@Value
public class SecurityContext {

    Set<Integer> accessibleTenantIds;
    Set<Integer> accessibleSubEntityIds;
    PermissionScope permissionScope;

    // Log correlation only, never part of SQL or cache keys
    String userId;

    @Builder
    public SecurityContext(Set<Integer> accessibleTenantIds,
                           Set<Integer> accessibleSubEntityIds,
                           PermissionScope permissionScope,
                           String userId) {
        this.accessibleTenantIds = accessibleTenantIds == null ? Set.of() : Set.copyOf(accessibleTenantIds);
        this.accessibleSubEntityIds = accessibleSubEntityIds == null ? Set.of() : Set.copyOf(accessibleSubEntityIds);
        this.permissionScope = permissionScope == null ? PermissionScope.OWN : permissionScope;
        this.userId = userId;
    }

    public boolean hasTenantAccess() {
        return !accessibleTenantIds.isEmpty();
    }
}
