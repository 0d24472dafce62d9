package com.starscape.astrocat.features.platesolve.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.domain.SolveHints;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The shared public solver at nova.astrometry.net. Submissions are always blind.
 *
 * <p>Annotated previews sit behind the site's bot check, so the download first warms up a
 * browser-like session, logs in through the API, and answers the human-check form if it is shown.
 */
@Component
public class NovaAstrometryClient extends AbstractAstrometryApiClient {

    private static final Pattern CSRF_FIELD = Pattern.compile("name=\"csrfmiddlewaretoken\" value=\"([^\"]+)\"");
    private static final Pattern NEXT_FIELD = Pattern.compile("name=\"next\" value=\"([^\"]+)\"");

    private final BrowserSessionFactory sessionFactory;

    public NovaAstrometryClient(
            @Qualifier("solverRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            AstrometryProperties properties,
            WcsFileParser wcsFileParser,
            BrowserSessionFactory sessionFactory) {
        super(restTemplate, objectMapper, properties.getNova(), wcsFileParser);
        this.sessionFactory = sessionFactory;
    }

    @Override
    public SolveProvider provider() {
        return SolveProvider.NOVA;
    }

    @Override
    protected void applyHints(Map<String, Object> request, SolveHints hints) {
        if (hints != null && !hints.isBlind()) {
            log.info("Public solver: ignoring hints for a fully blind solve");
        }
    }

    @Override
    public byte[] downloadAnnotatedPreview(String jobId) {
        String root = rootUrl();
        String url = root + "/annotated_display/" + jobId;
        BrowserSession session = sessionFactory.open();

        try {
            warmUp(session, root);

            ResponseEntity<byte[]> response = session.get(url, root + "/");
            if (isHtml(response) && isHumanCheck(body(response))) {
                log.info("Human check requested for job {}, answering it", jobId);
                response = answerHumanCheck(session, root, url, jobId, response);
            }

            if (!isImage(response) || response.getBody() == null) {
                if (isHtml(response) && isHumanCheck(body(response))) {
                    throw new PlateSolverException("Human check bypass failed for job " + jobId, false);
                }
                throw new PlateSolverException("Expected an image from " + url + " but got "
                        + response.getHeaders().getContentType(), false);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw translate("annotated preview", e);
        }
    }

    private void warmUp(BrowserSession session, String root) {
        try {
            session.get(root + "/", null);
        } catch (RestClientException e) {
            log.warn("Homepage session warm-up failed: {}", e.getMessage());
        }

        if (!isConfigured()) {
            return;
        }
        try {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("request-json", toJson(Map.of("apikey", apiKey())));
            session.postForm(root + "/api/login", form, root + "/");
        } catch (RestClientException | PlateSolverException e) {
            log.warn("API login during annotated download failed (ignored): {}", e.getMessage());
        }
    }

    private ResponseEntity<byte[]> answerHumanCheck(BrowserSession session, String root, String url, String jobId,
                                                   ResponseEntity<byte[]> challenge) {
        String html = body(challenge);
        Optional<String> csrf = session.cookie("csrftoken").or(() -> find(CSRF_FIELD, html));
        if (csrf.isEmpty()) {
            log.warn("No CSRF token on the human check page for job {}", jobId);
            return challenge;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("csrfmiddlewaretoken", csrf.get());
        form.add("human", "yup");
        form.add("next", find(NEXT_FIELD, html).orElse("/annotated_display/" + jobId));

        ResponseEntity<byte[]> response = session.postForm(root + "/am_human", form, url);
        if (!isImage(response)) {
            log.info("Human check answered, retrying download for job {}", jobId);
            response = session.get(url, root + "/");
        }
        return response;
    }

    static boolean isHumanCheck(String html) {
        return html.contains("Human check") || html.contains("am_human") || html.contains("ask_human");
    }

    private static Optional<String> find(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String body(ResponseEntity<byte[]> response) {
        return response.getBody() == null ? "" : new String(response.getBody(), StandardCharsets.UTF_8);
    }
}
