package com.ownmyhealth.phi.service;

public record AuthTokens(String accessToken, String refreshToken) {
}
