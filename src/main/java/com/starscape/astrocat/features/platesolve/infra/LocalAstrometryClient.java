package com.starscape.astrocat.features.platesolve.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.domain.SolveHints;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Self-hosted astrometry.net instance. Uploads carry a permissive default field-width
 * range, narrowed by any hints from a previous solution.
 */
@Component
public class LocalAstrometryClient extends AbstractAstrometryApiClient {

    private final BrowserSessionFactory sessionFactory;

    public LocalAstrometryClient(
            @Qualifier("solverRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            AstrometryProperties properties,
            WcsFileParser wcsFileParser,
            BrowserSessionFactory sessionFactory) {
        super(restTemplate, objectMapper, properties.getLocal(), wcsFileParser);
        this.sessionFactory = sessionFactory;
    }

    @Override
    public SolveProvider provider() {
        return SolveProvider.LOCAL;
    }

    @Override
    protected void applyHints(Map<String, Object> request, SolveHints hints) {
        request.put("scale_units", "degwidth");
        request.put("scale_lower", 0.1);
        request.put("scale_upper", 180.0);
        if (hints != null) {
            request.putAll(hints.toRequestFields());
        }
    }

    @Override
    public byte[] downloadAnnotatedPreview(String jobId) {
        String url = rootUrl() + "/annotated_display/" + jobId;
        ResponseEntity<byte[]> response;
        try {
            response = sessionFactory.open().get(url, null);
        } catch (RestClientException e) {
            throw translate("annotated preview", e);
        }
        if (!isImage(response) || response.getBody() == null) {
            throw new PlateSolverException("Expected an image from " + url + " but got "
                    + response.getHeaders().getContentType(), false);
        }
        return response.getBody();
    }
}
