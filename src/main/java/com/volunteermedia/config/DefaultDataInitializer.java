package com.volunteermedia.config;

import com.volunteermedia.service.SeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the default groups, system comment tags and site settings on startup.
 */
@Component
@ConditionalOnProperty(name = "app.seed.defaults", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DefaultDataInitializer implements ApplicationRunner {

    private final SeedService seedService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Ensuring default groups, comment tags and site settings");
        seedService.ensureDefaults();
    }
}
