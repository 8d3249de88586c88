package com.ownmyhealth.phi.service;

public record SessionMetadata(String ipAddress, String userAgent) {

    public static SessionMetadata none() {
        return new SessionMetadata(null, null);
    }
}
