package com.ownmyhealth.phi.controller;

import com.ownmyhealth.phi.audit.AuditContext;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.exception.AuthenticationFailedException;
import com.ownmyhealth.phi.exception.ValidationException;
import com.ownmyhealth.phi.filter.SecurityContext;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.security.TokenClaims;
import com.ownmyhealth.phi.service.ProfileService;
import com.ownmyhealth.phi.service.UserProfile;
import com.ownmyhealth.phi.service.UserSaltService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/v1/profile"})
public class ProfileController {
    private final ProfileService profileService;
    private final UserSaltService userSaltService;
    private final AuditLogService auditLogService;

    public ProfileController(ProfileService profileService, UserSaltService userSaltService, AuditLogService auditLogService) {
        this.profileService = profileService;
        this.userSaltService = userSaltService;
        this.auditLogService = auditLogService;
    }

    @GetMapping
    public UserProfile get(HttpServletRequest request) {
        TokenClaims claims = requireClaims();
        return this.profileService.getProfile(claims.userId(), this.context(request, claims));
    }

    @PutMapping
    public UserProfile update(@RequestBody(required=false) UserProfile profile, HttpServletRequest request) {
        TokenClaims claims = requireClaims();
        if (profile == null) {
            throw new ValidationException("Profile body is required");
        }
        return this.profileService.updateProfile(claims.userId(), profile, this.context(request, claims));
    }

    /**
     * Re-keys the caller's profile under a fresh salt.
     */
    @PostMapping(value={"/rotate-key"})
    public Map<String, Object> rotateKey() {
        TokenClaims claims = requireClaims();
        User user = this.userSaltService.rotateSalt(claims.userId());
        return Map.of("success", true, "saltVersion", user.getSaltVersion());
    }

    private AuditContext context(HttpServletRequest request, TokenClaims claims) {
        return this.auditLogService.extractContext(request).withUser(claims.userId());
    }

    private static TokenClaims requireClaims() {
        TokenClaims claims = SecurityContext.getCurrentClaims();
        if (claims == null) {
            throw new AuthenticationFailedException("Not authenticated");
        }
        return claims;
    }
}
