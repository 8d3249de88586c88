package com.ownmyhealth.phi.security;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    private TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return this.claimValue;
    }

    public static TokenType fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
