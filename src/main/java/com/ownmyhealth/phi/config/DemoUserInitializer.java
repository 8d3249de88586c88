package com.ownmyhealth.phi.config;

import com.ownmyhealth.phi.service.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class DemoUserInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DemoUserInitializer.class);
    private final AuthService authService;

    public DemoUserInitializer(AuthService authService) {
        this.authService = authService;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            this.authService.initializeDemoUser();
        } catch (DataAccessException e) {
            // The store may still be coming up; the next restart provisions the account.
            log.warn("Could not create/verify demo user: {}", e.getMessage());
        }
    }
}
