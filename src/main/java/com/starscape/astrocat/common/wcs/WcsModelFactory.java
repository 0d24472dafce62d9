package com.starscape.astrocat.common.wcs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Builds the WCS model for an image. A stored distortion solution takes precedence
 * over the summary fields; if it is present but unusable there is no model.
 */
@Component
public class WcsModelFactory {

    private static final Logger log = LoggerFactory.getLogger(WcsModelFactory.class);
    private static final TypeReference<Map<String, Object>> HEADER_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public WcsModelFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<WcsModel> build(AstrometrySummary summary) {
        if (summary == null) {
            return Optional.empty();
        }
        if (summary.hasDistortion()) {
            try {
                Map<String, Object> header = objectMapper.readValue(summary.distortionJson(), HEADER_TYPE);
                if (header == null || header.isEmpty()) {
                    log.warn("Stored distortion solution is empty");
                    return Optional.empty();
                }
                return Optional.of(SipWcs.fromHeader(header, summary.widthPixels(), summary.heightPixels()));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Stored distortion solution is unusable: {}", e.getMessage());
                return Optional.empty();
            }
        }
        if (!summary.hasLinearSolution()) {
            return Optional.empty();
        }
        try {
            return Optional.of(TangentPlaneWcs.fromSummary(summary));
        } catch (IllegalArgumentException e) {
            log.debug("Cannot build tangent-plane model: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
