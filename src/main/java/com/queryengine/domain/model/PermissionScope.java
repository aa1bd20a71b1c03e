package com.queryengine.domain.model;

/**
 * Breadth of data a resolved user may see.
 */
public enum PermissionScope {
    OWN,
    ORGANIZATION,
    ALL
}
