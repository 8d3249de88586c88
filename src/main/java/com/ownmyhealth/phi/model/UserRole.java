package com.ownmyhealth.phi.model;

import java.util.Set;

public enum UserRole {
    PATIENT(Set.of(Permission.READ_OWN_PHI, Permission.WRITE_OWN_PHI)),
    PROVIDER(Set.of(Permission.READ_OWN_PHI, Permission.WRITE_OWN_PHI, Permission.READ_PATIENT_PHI)),
    ADMIN(Set.of(Permission.READ_OWN_PHI, Permission.WRITE_OWN_PHI, Permission.MANAGE_USERS, Permission.VIEW_AUDIT, Permission.DECRYPT_AUDIT));

    private final Set<Permission> permissions;

    private UserRole(Set<Permission> permissions) {
        this.permissions = permissions;
    }

    public Set<Permission> getPermissions() {
        return this.permissions;
    }

    public boolean hasPermission(Permission permission) {
        return this.permissions.contains(permission);
    }

    public static enum Permission {
        READ_OWN_PHI,
        WRITE_OWN_PHI,
        READ_PATIENT_PHI,
        MANAGE_USERS,
        VIEW_AUDIT,
        DECRYPT_AUDIT;

    }
}
