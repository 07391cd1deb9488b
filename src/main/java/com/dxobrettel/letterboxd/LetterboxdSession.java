package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.AuthenticationException;
import com.dxobrettel.letterboxd.error.LetterboxdConnectionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the HTTP client and its cookie jar for one connector instance.
 *
 * <p>States: anonymous until {@link #login} succeeds, authenticated afterwards for
 * the lifetime of the object. There is no logout. A failed login leaves the session
 * anonymous and is never retried.
 */
public class LetterboxdSession {

    private static final Logger log = LoggerFactory.getLogger(LetterboxdSession.class);

    public static final String CSRF_COOKIE = "com.xk72.webparts.csrf";
    public static final String CSRF_FIELD = "__csrf";
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:133.0) Gecko/20100101 Firefox/133.0";

    private final HttpClient http;
    private final CookieManager cookies;
    private final ObjectMapper mapper;
    private final LetterboxdUrls urls;
    private final String userAgent;

    private volatile boolean initialized;
    private volatile boolean authenticated;

    public LetterboxdSession(LetterboxdUrls urls, String userAgent, ObjectMapper mapper) {
        this(urls, userAgent, mapper, new CookieManager(null, CookiePolicy.ACCEPT_ALL));
    }

    LetterboxdSession(LetterboxdUrls urls, String userAgent, ObjectMapper mapper, CookieManager cookies) {
        this.urls = urls;
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent;
        this.mapper = mapper;
        this.cookies = cookies;
        this.http = HttpClient.newBuilder()
                .cookieHandler(cookies)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Fetches the site root once so the cookie jar receives the anti-forgery token.
     */
    public void initialize() throws LetterboxdConnectionException, InterruptedException {
        HttpResponse<String> resp = get(urls.root());
        if (resp.statusCode() != 200) {
            throw new LetterboxdConnectionException("Failed to initialize session with Letterboxd", resp.statusCode());
        }
        initialized = true;
        log.info("Session initialized with {}", urls.baseUrl());
    }

    /**
     * Posts the credentials with the current token. Sets the session authenticated only
     * when the response carries {@code result == "success"}.
     */
    public void login(String username, String password) throws AuthenticationException, InterruptedException {
        if (!initialized) {
            throw new IllegalStateException("initialize() must run before login()");
        }
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new AuthenticationException("Username and password must be provided to log in");
        }

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("username", username);
        form.put("password", password);
        form.put(CSRF_FIELD, csrfTokenOrEmpty());

        HttpResponse<String> resp;
        try {
            resp = http.send(formRequest(urls.login(), form), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AuthenticationException("Login request failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            throw new AuthenticationException("Login failed with HTTP " + resp.statusCode());
        }

        String result;
        try {
            result = mapper.readTree(resp.body()).path("result").asText(null);
        } catch (IOException e) {
            throw new AuthenticationException("Login response is not valid JSON", e);
        }
        if (!"success".equals(result)) {
            log.warn("Login rejected for '{}' (result={})", username, result);
            throw new AuthenticationException("Login failed. Please check your credentials.");
        }

        authenticated = true;
        log.info("Logged in as '{}'", username);
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Throws unless logged in. Call before any request of a mutating operation.
     */
    public void requireAuthenticated(String action) throws AuthenticationException {
        if (!authenticated) {
            throw new AuthenticationException("User must be logged in to " + action);
        }
    }

    /**
     * Reads the anti-forgery token from the cookie jar. Re-read on every call; the
     * site rotates it.
     */
    public Optional<String> csrfToken() {
        for (HttpCookie cookie : cookies.getCookieStore().get(urls.root())) {
            if (CSRF_COOKIE.equals(cookie.getName())) {
                return Optional.ofNullable(cookie.getValue());
            }
        }
        return Optional.empty();
    }

    private String csrfTokenOrEmpty() {
        return csrfToken().orElse("");
    }

    public LetterboxdUrls urls() {
        return urls;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    CookieStore cookieStore() {
        return cookies.getCookieStore();
    }

    // =========================================================================
    // Requests
    // =========================================================================

    public HttpResponse<String> get(URI uri) throws LetterboxdConnectionException, InterruptedException {
        log.debug("GET {}", uri);
        HttpRequest req = baseRequest(uri).GET().build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LetterboxdConnectionException("GET " + uri + " failed: " + e.getMessage(), e);
        }
    }

    public HttpResponse<byte[]> getBytes(URI uri) throws LetterboxdConnectionException, InterruptedException {
        log.debug("GET {} (binary)", uri);
        HttpRequest req = baseRequest(uri).GET().build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new LetterboxdConnectionException("GET " + uri + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fetches a page and fails unless it answered 200.
     */
    public String getPage(URI uri) throws LetterboxdConnectionException, InterruptedException {
        HttpResponse<String> resp = get(uri);
        if (resp.statusCode() != 200) {
            throw new LetterboxdConnectionException("Failed to retrieve " + uri, resp.statusCode());
        }
        return resp.body();
    }

    /**
     * Posts a form with a freshly read token appended as {@code __csrf}.
     */
    public HttpResponse<String> postForm(URI uri, Map<String, ?> fields) throws LetterboxdConnectionException, InterruptedException {
        Map<String, Object> form = new LinkedHashMap<>(fields);
        form.put(CSRF_FIELD, csrfTokenOrEmpty());
        log.debug("POST {}", uri);
        try {
            return http.send(formRequest(uri, form), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LetterboxdConnectionException("POST " + uri + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Posts a form and requires HTTP 200 plus a truthy {@code result} in the JSON reply.
     */
    public JsonNode postExpectingResult(URI uri, Map<String, ?> fields, String failureMessage)
            throws LetterboxdConnectionException, InterruptedException {
        HttpResponse<String> resp = postForm(uri, fields);
        if (resp.statusCode() != 200) {
            throw new LetterboxdConnectionException(failureMessage, resp.statusCode());
        }
        JsonNode root;
        try {
            root = mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new LetterboxdConnectionException(failureMessage + ": response is not valid JSON", e);
        }
        if (root == null || !isTruthy(root.get("result"))) {
            throw new LetterboxdConnectionException(failureMessage);
        }
        return root;
    }

    private HttpRequest formRequest(URI uri, Map<String, ?> form) {
        return baseRequest(uri)
                .header("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8")
                .header("X-Requested-With", "XMLHttpRequest")
                .POST(HttpRequest.BodyPublishers.ofString(LetterboxdUrls.formBody(form), StandardCharsets.UTF_8))
                .build();
    }

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .header("User-Agent", userAgent);
    }

    static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asInt() != 0;
        }
        if (node.isTextual()) {
            String text = node.asText();
            return "true".equalsIgnoreCase(text) || "success".equalsIgnoreCase(text);
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return false;
    }
}
