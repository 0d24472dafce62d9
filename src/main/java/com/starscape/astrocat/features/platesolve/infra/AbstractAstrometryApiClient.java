package com.starscape.astrocat.features.platesolve.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.platesolve.domain.Calibration;
import com.starscape.astrocat.features.platesolve.domain.JobState;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.domain.PreparedUpload;
import com.starscape.astrocat.features.platesolve.domain.SolveHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The astrometry.net JSON API, shared by the public service and self-hosted instances.
 *
 * <p>Requests carry their JSON payload in a {@code request-json} form field. Subclasses decide
 * how hints are applied and how the annotated preview is downloaded.
 */
public abstract class AbstractAstrometryApiClient implements PlateSolverClient {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final AstrometryProperties.Endpoint endpoint;
    private final WcsFileParser wcsFileParser;

    protected AbstractAstrometryApiClient(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            AstrometryProperties.Endpoint endpoint,
            WcsFileParser wcsFileParser) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.wcsFileParser = wcsFileParser;
    }

    /**
     * Add solver hints (or defaults) to the upload payload.
     */
    protected abstract void applyHints(Map<String, Object> request, SolveHints hints);

    @Override
    public boolean isConfigured() {
        return endpoint.isConfigured();
    }

    @Override
    public String apiKey() {
        return endpoint.getApiKey();
    }

    @Override
    public String login(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PlateSolverException(provider() + " API key is not configured", false);
        }
        JsonNode response = postForm(apiUrl("/login"), Map.of("apikey", apiKey), "login");
        if (!"success".equals(response.path("status").asText())) {
            throw new PlateSolverException("Login failed: " + response.path("message").asText("unknown error"), false);
        }
        String session = response.path("session").asText(null);
        if (session == null || session.isBlank()) {
            throw new PlateSolverException("Login returned no session", false);
        }
        return session;
    }

    @Override
    public String upload(String session, PreparedUpload upload, SolveHints hints) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("publicly_visible", "n");
        request.put("allow_commercial_use", "d");
        request.put("allow_modifications", "d");
        request.put("session", session);
        applyHints(request, hints);

        Map<String, Object> logged = new LinkedHashMap<>(request);
        logged.put("session", "REDACTED");
        log.info("Submitting {} to {} with payload {}", upload.fileName(), apiUrl("/upload"), logged);

        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(MediaType.parseMediaType(upload.contentType()));
        ByteArrayResource file = new ByteArrayResource(upload.content()) {
            @Override
            public String getFilename() {
                return upload.fileName();
            }
        };

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("request-json", toJson(request));
        parts.add("file", new HttpEntity<>(file, fileHeaders));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        JsonNode response = exchangeJson(() -> restTemplate.postForEntity(
                apiUrl("/upload"), new HttpEntity<>(parts, headers), String.class), "upload");

        JsonNode subId = response.path("subid");
        if (subId.isMissingNode() || subId.isNull()) {
            throw new PlateSolverException("No submission id returned: " + response, false);
        }
        return subId.asText();
    }

    @Override
    public List<String> getSubmissionJobs(String submissionId) {
        JsonNode response = getJson(apiUrl("/submissions/" + submissionId), "submission status");
        List<String> jobs = new ArrayList<>();
        for (JsonNode job : response.path("jobs")) {
            if (!job.isNull()) {
                jobs.add(job.asText());
            }
        }
        return jobs;
    }

    @Override
    public JobState getJobStatus(String jobId) {
        String status = getJson(apiUrl("/jobs/" + jobId), "job status").path("status").asText("");
        return switch (status) {
            case "success" -> JobState.SUCCESS;
            case "failure" -> JobState.FAILURE;
            default -> JobState.PENDING;
        };
    }

    @Override
    public Calibration getCalibration(String jobId) {
        JsonNode cal = getJson(apiUrl("/jobs/" + jobId + "/calibration"), "calibration");
        if (!cal.path("ra").isNumber() || !cal.path("dec").isNumber()) {
            throw new PlateSolverException("Calibration for job " + jobId + " has no centre: " + cal, false);
        }
        try {
            return Calibration.of(
                cal.path("ra").asDouble(),
                cal.path("dec").asDouble(),
                optionalDouble(cal, "radius"),
                optionalDouble(cal, "pixscale"),
                optionalDouble(cal, "orientation"),
                optionalDouble(cal, "parity"));
        } catch (IllegalArgumentException e) {
            throw new PlateSolverException("Invalid calibration for job " + jobId + ": " + e.getMessage(), false, e);
        }
    }

    @Override
    public Map<String, Object> getDistortionSolution(String jobId) {
        byte[] fits = getBytes(rootUrl() + "/wcs_file/" + jobId, "WCS file");
        return wcsFileParser.parse(fits);
    }

    @Override
    public String statusPageUrl(String submissionId) {
        return rootUrl() + "/status/" + submissionId;
    }

    protected String apiUrl(String path) {
        return trimTrailingSlash(endpoint.getUrl()) + path;
    }

    /**
     * Site root: the API URL without its {@code /api} suffix.
     */
    protected String rootUrl() {
        String base = trimTrailingSlash(endpoint.getUrl());
        return base.endsWith("/api") ? base.substring(0, base.length() - 4) : base;
    }

    protected JsonNode postForm(String url, Map<String, Object> payload, String operation) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("request-json", toJson(payload));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return exchangeJson(() -> restTemplate.postForEntity(url, new HttpEntity<>(form, headers), String.class),
                operation);
    }

    protected JsonNode getJson(String url, String operation) {
        return exchangeJson(() -> restTemplate.getForEntity(url, String.class), operation);
    }

    protected byte[] getBytes(String url, String operation) {
        try {
            byte[] body = restTemplate.getForObject(url, byte[].class);
            if (body == null || body.length == 0) {
                throw new PlateSolverException("Empty " + operation + " response from " + url, false);
            }
            return body;
        } catch (RestClientException e) {
            throw translate(operation, e);
        }
    }

    private JsonNode exchangeJson(RestCall call, String operation) {
        String body;
        try {
            ResponseEntity<String> response = call.execute();
            body = response.getBody();
        } catch (RestClientException e) {
            throw translate(operation, e);
        }
        if (body == null || body.isBlank()) {
            throw new PlateSolverException("Empty " + operation + " response", true);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PlateSolverException("Malformed " + operation + " response: " + e.getOriginalMessage(), false, e);
        }
    }

    protected PlateSolverException translate(String operation, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new PlateSolverException(operation + " failed: " + e.getMessage(), true, e);
        }
        if (e instanceof HttpServerErrorException) {
            return new PlateSolverException(operation + " failed: " + e.getMessage(), true, e);
        }
        if (e instanceof HttpClientErrorException clientError
                && clientError.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
            return new PlateSolverException(operation + " throttled by solver", true, e);
        }
        return new PlateSolverException(operation + " failed: " + e.getMessage(), false, e);
    }

    protected static boolean isImage(ResponseEntity<byte[]> response) {
        MediaType type = response.getHeaders().getContentType();
        return type != null && "image".equalsIgnoreCase(type.getType());
    }

    protected static boolean isHtml(ResponseEntity<byte[]> response) {
        MediaType type = response.getHeaders().getContentType();
        return type != null && type.isCompatibleWith(MediaType.TEXT_HTML);
    }

    protected String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PlateSolverException("Cannot encode request: " + e.getOriginalMessage(), false, e);
        }
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            throw new PlateSolverException("Solver URL is not configured", false);
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @FunctionalInterface
    private interface RestCall {
        ResponseEntity<String> execute();
    }
}
