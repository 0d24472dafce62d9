package com.starscape.astrocat;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.common.config.AwsProperties;
import com.starscape.astrocat.common.config.MatchingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AstrometryProperties.class, AwsProperties.class, MatchingProperties.class})
public class AstroCatApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstroCatApplication.class, args);
    }
}
