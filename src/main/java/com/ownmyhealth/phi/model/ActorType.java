package com.ownmyhealth.phi.model;

public enum ActorType {
    USER,
    SYSTEM,
    API,
    ADMIN,
    ANONYMOUS;

}
