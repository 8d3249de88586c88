package com.ownmyhealth.phi.model;

public enum AuditAction {
    LOGIN,
    LOGOUT,
    LOGIN_FAILED,
    PASSWORD_CHANGE,
    PASSWORD_RESET,
    READ,
    VIEW,
    EXPORT,
    PRINT,
    CREATE,
    UPDATE,
    DELETE,
    PHI_ACCESS,
    PHI_EXPORT,
    PHI_DECRYPT,
    PERMISSION_CHANGE,
    SETTINGS_CHANGE,
    KEY_ROTATION;

}
