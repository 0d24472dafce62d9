package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.common.config.AstrometryProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class BrowserSessionFactory {

    private final Duration timeout;

    public BrowserSessionFactory(AstrometryProperties properties) {
        this.timeout = Duration.ofSeconds(properties.getHttpTimeoutSeconds());
    }

    public BrowserSession open() {
        return new BrowserSession(timeout);
    }
}
