package com.ownmyhealth.phi.config;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.ownmyhealth.phi.service.AuthService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

class DemoUserInitializerTest {

    @Test
    void provisionsDemoUserOnStartup() {
        AuthService authService = mock(AuthService.class);

        new DemoUserInitializer(authService).run(new DefaultApplicationArguments());

        verify(authService).initializeDemoUser();
    }

    @Test
    void unavailableStoreDoesNotAbortStartup() {
        AuthService authService = mock(AuthService.class);
        doThrow(new DataAccessResourceFailureException("store down")).when(authService).initializeDemoUser();

        assertDoesNotThrow(() -> new DemoUserInitializer(authService).run(new DefaultApplicationArguments()));
    }
}
