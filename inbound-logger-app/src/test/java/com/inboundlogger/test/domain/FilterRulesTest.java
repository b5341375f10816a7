package com.inboundlogger.test.domain;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.service.FilterRules;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.exception.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FilterRulesTest {

    private LoggerConfiguration configuration;

    @BeforeEach
    public void setUp() {
        configuration = new LoggerConfiguration();
    }

    @Test
    public void shouldExcludeDefaultPathsAndKeepApplicationPaths() {
        FilterRules rules = configuration.filterRules();

        Assertions.assertFalse(rules.shouldLogPath("/health"));
        Assertions.assertFalse(rules.shouldLogPath("/assets/app.css"));
        Assertions.assertFalse(rules.shouldLogPath("/favicon.ico"));
        Assertions.assertFalse(rules.shouldLogPath("/actuator/metrics"));
        Assertions.assertTrue(rules.shouldLogPath("/users"));
        Assertions.assertTrue(rules.shouldLogPath("/healthcheck-report"));
        Assertions.assertFalse(rules.shouldLogPath(null));
    }

    @Test
    public void shouldMatchCustomPatternAnywhereInPath() {
        configuration.excludePath("internal");

        Assertions.assertFalse(configuration.shouldLogPath("/api/internal/jobs"));
        Assertions.assertTrue(configuration.shouldLogPath("/api/public/jobs"));

        configuration.removeExcludedPath("internal");
        Assertions.assertTrue(configuration.shouldLogPath("/api/internal/jobs"));
    }

    @Test
    public void shouldRejectInvalidPathPattern() {
        Assertions.assertThrows(ConfigurationException.class, () -> configuration.excludePath("[unclosed"));
    }

    @Test
    public void shouldLogEverythingAfterClearingExcludedPaths() {
        configuration.clearExcludedPaths();

        Assertions.assertTrue(configuration.shouldLogPath("/health"));
        Assertions.assertTrue(configuration.shouldLogPath("/assets/app.js"));
    }

    @Test
    public void shouldIgnoreContentTypeParametersAndCase() {
        FilterRules rules = configuration.filterRules();

        Assertions.assertFalse(rules.shouldLogContentType("text/html; charset=utf-8"));
        Assertions.assertFalse(rules.shouldLogContentType("IMAGE/PNG"));
        Assertions.assertTrue(rules.shouldLogContentType("application/json;charset=UTF-8"));
        Assertions.assertTrue(rules.shouldLogContentType(null));
        Assertions.assertTrue(rules.shouldLogContentType(""));
    }

    @Test
    public void shouldApplyControllerAndActionExclusions() {
        configuration.excludeController("reports");
        configuration.excludeAction("users", "export");

        Assertions.assertFalse(configuration.enabledForController("basicError", "error"));
        Assertions.assertFalse(configuration.enabledForController("reports", "index"));
        Assertions.assertFalse(configuration.enabledForController("users", "export"));
        Assertions.assertTrue(configuration.enabledForController("users", "index"));
        Assertions.assertTrue(configuration.enabledForController("users", null));
        Assertions.assertTrue(configuration.enabledForController(null, "anything"));
    }

    @Test
    public void shouldRedactSensitiveHeadersBySubstring() {
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer abc");
        headers.put("X-Custom-Auth-Token", "t");
        headers.put("User-Agent", "curl/8.0");
        headers.put("Accept", List.of("application/json", "text/plain"));

        Map<String, String> filtered = configuration.filterHeaders(headers);

        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("Authorization"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("X-Custom-Auth-Token"));
        Assertions.assertEquals("curl/8.0", filtered.get("User-Agent"));
        Assertions.assertEquals("application/json, text/plain", filtered.get("Accept"));
    }

    @Test
    public void shouldReturnEmptyHeadersForNonMapInput() {
        Assertions.assertTrue(configuration.filterHeaders("Authorization: x").isEmpty());
        Assertions.assertTrue(configuration.filterHeaders(null).isEmpty());
    }

    @Test
    public void shouldRedactNestedBodyKeys() {
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("card_number", "4111111111111111");
        card.put("holder", "A. Person");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", Map.of("name", "alice", "password", "p"));
        body.put("payments", List.of(card));
        body.put("count", 2);

        @SuppressWarnings("unchecked")
        Map<String, Object> filtered = (Map<String, Object>) configuration.filterSensitiveData(body);

        @SuppressWarnings("unchecked")
        Map<String, Object> user = (Map<String, Object>) filtered.get("user");
        Assertions.assertEquals("alice", user.get("name"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, user.get("password"));
        @SuppressWarnings("unchecked")
        Map<String, Object> payment = (Map<String, Object>) ((List<Object>) filtered.get("payments")).get(0);
        Assertions.assertEquals(Constants.REDACTION_MARKER, payment.get("card_number"));
        Assertions.assertEquals("A. Person", payment.get("holder"));
        Assertions.assertEquals(2, filtered.get("count"));
        Assertions.assertEquals("4111111111111111", card.get("card_number"));
    }

    @Test
    public void shouldRedactByCaseInsensitiveSubstring() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("API_KEY", "k");
        body.put("userPassword", "p");
        body.put("monkey", "banana");
        body.put("title", "ok");

        @SuppressWarnings("unchecked")
        Map<String, Object> filtered = (Map<String, Object>) configuration.filterSensitiveData(body);

        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("API_KEY"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("userPassword"));
        // "monkey" contains "key"
        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("monkey"));
        Assertions.assertEquals("ok", filtered.get("title"));
    }

    @Test
    public void shouldFilterJsonTextAndPassThroughOtherText() {
        String filtered = configuration.filterBody("{\"password\":\"secret\",\"name\":\"bob\"}");

        Assertions.assertEquals("{\"password\":\"[FILTERED]\",\"name\":\"bob\"}", filtered);
        Assertions.assertEquals("not json password=1", configuration.filterBody("not json password=1"));
        Assertions.assertNull(configuration.filterBody(null));
        Assertions.assertEquals("", configuration.filterBody(""));
    }

    @Test
    public void shouldNotProcessOversizeBodyText() {
        configuration.setMaxBodySize(10);
        String body = "{\"password\":\"secret-value\"}";

        Assertions.assertEquals(body, configuration.filterBody(body));
    }

    @Test
    public void shouldStopAtCyclesAndMaxDepth() {
        Map<String, Object> cyclic = new LinkedHashMap<>();
        cyclic.put("name", "root");
        cyclic.put("self", cyclic);

        @SuppressWarnings("unchecked")
        Map<String, Object> filtered = (Map<String, Object>) configuration.filterSensitiveData(cyclic);
        Assertions.assertEquals("root", filtered.get("name"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, filtered.get("self"));

        List<Object> deep = new ArrayList<>();
        List<Object> cursor = deep;
        for (int i = 0; i < FilterRules.MAX_DEPTH + 10; i++) {
            List<Object> next = new ArrayList<>();
            cursor.add(next);
            cursor = next;
        }
        Assertions.assertDoesNotThrow(() -> configuration.filterSensitiveData(deep));
    }

    @Test
    public void shouldReturnScalarsUnchanged() {
        Assertions.assertEquals("text", configuration.filterSensitiveData("text"));
        Assertions.assertEquals(42, configuration.filterSensitiveData(42));
        Assertions.assertNull(configuration.filterSensitiveData(null));
    }

    @Test
    public void shouldExtendSensitiveFragments() {
        configuration.addSensitiveHeader("X-Tenant");
        configuration.addSensitiveBodyKey("Iban");

        Assertions.assertTrue(configuration.filterRules().isSensitiveHeader("x-tenant-id"));
        Assertions.assertTrue(configuration.filterRules().isSensitiveBodyKey("customer_iban"));
    }
}
