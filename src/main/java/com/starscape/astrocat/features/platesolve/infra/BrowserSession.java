package com.starscape.astrocat.features.platesolve.infra;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * A cookie-keeping HTTP session that presents itself like a desktop browser. The public
 * solver serves annotated images only to sessions that look interactive.
 */
public class BrowserSession {

    static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final CookieManager cookieManager;
    private final RestTemplate restTemplate;

    public BrowserSession(Duration timeout) {
        this.cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        HttpClient httpClient = HttpClient.newBuilder()
                .cookieHandler(cookieManager)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        this.restTemplate = new RestTemplate(requestFactory);
    }

    public ResponseEntity<byte[]> get(String url, String referer) {
        return restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers(referer)), byte[].class);
    }

    public ResponseEntity<byte[]> postForm(String url, MultiValueMap<String, String> form, String referer) {
        HttpHeaders headers = headers(referer);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(form, headers), byte[].class);
    }

    public Optional<String> cookie(String name) {
        return cookieManager.getCookieStore().getCookies().stream()
                .filter(cookie -> name.equals(cookie.getName()))
                .map(HttpCookie::getValue)
                .findFirst();
    }

    private HttpHeaders headers(String referer) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.ACCEPT,
                "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,image/apng,*/*;q=0.8");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        if (referer != null) {
            headers.set(HttpHeaders.REFERER, referer);
        }
        return headers;
    }
}
