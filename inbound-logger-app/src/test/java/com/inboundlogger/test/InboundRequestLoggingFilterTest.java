package com.inboundlogger.test;

import com.google.common.base.Ticker;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.context.model.valobj.LoggableReference;
import com.inboundlogger.domain.context.service.ControllerLoggingRegistry;
import com.inboundlogger.domain.context.service.RequestLogContextHolder;
import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.domain.log.service.RequestLogSinkDispatcher;
import com.inboundlogger.domain.log.service.TestRequestLogSink;
import com.inboundlogger.trigger.capture.CachedBodyHttpServletRequest;
import com.inboundlogger.trigger.capture.ControllerLoggingInterceptor;
import com.inboundlogger.trigger.capture.InboundRequestLoggingFilter;
import com.inboundlogger.test.support.InMemoryRequestLogStorageAdapter;
import com.inboundlogger.test.support.InterruptedServletInputStream;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.CaptureStage;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class InboundRequestLoggingFilterTest {

    private ConfigurationScope scope;
    private InMemoryRequestLogStorageAdapter primary;
    private Logger logger;
    private InboundRequestLoggingFilter filter;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        RequestLogContextHolder.clear();
        logger = mock(Logger.class);
        scope = new ConfigurationScope();
        scope.configure(configuration -> {
            configuration.setEnabled(true);
            configuration.setLoggerFactory(() -> logger);
        });
        primary = new InMemoryRequestLogStorageAdapter(new RequestLogAssembler(scope));
        IStorageAdapterFactory factory = mock(IStorageAdapterFactory.class);
        when(factory.primary()).thenReturn(primary);
        RequestLogSinkDispatcher dispatcher = new RequestLogSinkDispatcher(scope, factory, new TestRequestLogSink(factory));
        filter = new InboundRequestLoggingFilter(scope, dispatcher, new SteppingTicker(100));

        mockMvc = MockMvcBuilders.standaloneSetup(new UsersController(), new HealthController())
                .addInterceptors(new ControllerLoggingInterceptor(scope, new ControllerLoggingRegistry()))
                .addFilters(filter)
                .build();
    }

    @AfterEach
    public void tearDown() {
        RequestLogContextHolder.clear();
    }

    @Test
    public void shouldLogBasicGet() throws Exception {
        mockMvc.perform(get("/users").header("User-Agent", "junit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        Assertions.assertEquals(1, primary.records().size());
        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals("GET", entity.getHttpMethod());
        Assertions.assertEquals("/users", entity.getUrl());
        Assertions.assertEquals(200, entity.getStatusCode());
        Assertions.assertEquals(100.0D, entity.getDurationMs());
        Assertions.assertEquals(true, ((Map<?, ?>) entity.getResponseBody()).get("success"));
        Assertions.assertEquals("users", entity.getMetadata().get("controller"));
        Assertions.assertEquals("index", entity.getMetadata().get("action"));
        Assertions.assertEquals("junit", entity.getUserAgent());
    }

    @Test
    public void shouldRedactHeadersAndBody() throws Exception {
        mockMvc.perform(post("/users")
                        .header("Authorization", "Bearer xyz")
                        .header("User-Agent", "junit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"alice\",\"password\":\"hunter2\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("alice"));

        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals(Constants.REDACTION_MARKER, entity.getRequestHeaders().get("Authorization"));
        Assertions.assertEquals("junit", entity.getRequestHeaders().get("User-Agent"));
        Map<?, ?> body = (Map<?, ?>) entity.getRequestBody();
        Assertions.assertEquals("alice", body.get("name"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, body.get("password"));
        Assertions.assertEquals(201, entity.getStatusCode());
    }

    @Test
    public void shouldSkipOversizeBodiesButKeepHandlerInput() throws Exception {
        scope.configure(configuration -> configuration.setMaxBodySize(10));

        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"a-rather-long-name\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("a-rather-long-name"));

        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertNotNull(entity);
        Assertions.assertNull(entity.getRequestBody());
        Assertions.assertNull(entity.getResponseBody());
    }

    @Test
    public void shouldNotLogExcludedPath() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("ok"));

        Assertions.assertTrue(primary.records().isEmpty());
    }

    @Test
    public void shouldNotLogWhenDisabled() throws Exception {
        scope.configure(configuration -> configuration.setEnabled(false));

        mockMvc.perform(get("/users")).andExpect(status().isOk());

        Assertions.assertTrue(primary.records().isEmpty());
    }

    @Test
    public void shouldNotLogExcludedContentType() throws Exception {
        mockMvc.perform(get("/users/page")).andExpect(status().isOk());

        Assertions.assertTrue(primary.records().isEmpty());
    }

    @Test
    public void shouldNotLogExcludedController() throws Exception {
        scope.configure(configuration -> configuration.excludeController("users"));

        mockMvc.perform(get("/users")).andExpect(status().isOk());

        Assertions.assertTrue(primary.records().isEmpty());
    }

    @Test
    public void shouldKeepResponseWhenPrimarySinkFails() throws Exception {
        primary.failWith(new IllegalStateException("disk full"));

        mockMvc.perform(get("/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(logger).error(eq("SINK_WRITE_FAILED sink={}, errorType={}, errorMessage={}"),
                eq(RequestLogSinkDispatcher.SINK_PRIMARY), eq("IllegalStateException"), eq("disk full"));
    }

    @Test
    public void shouldAttachContextAndClearItAfterRequest() throws Exception {
        mockMvc.perform(get("/users/7")).andExpect(status().isOk());

        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals("User", entity.getLoggableType());
        Assertions.assertEquals(7L, entity.getLoggableId());
        Assertions.assertEquals("lookup", entity.getMetadata().get("feature"));
        Assertions.assertTrue(RequestLogContextHolder.getMetadata().isEmpty());
        Assertions.assertNull(RequestLogContextHolder.getLoggable());
    }

    @Test
    public void shouldPropagateHandlerExceptionWithoutLogging() {
        Assertions.assertThrows(Exception.class, () -> mockMvc.perform(get("/users/boom")));

        Assertions.assertTrue(primary.records().isEmpty());
        Assertions.assertTrue(RequestLogContextHolder.getMetadata().isEmpty());
    }

    @Test
    public void shouldSkipBodyForNoContent() throws Exception {
        mockMvc.perform(post("/users/7/archive")).andExpect(status().isNoContent());

        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals(204, entity.getStatusCode());
        Assertions.assertNull(entity.getResponseBody());
    }

    @Test
    public void shouldUseForwardedIpAndRequestId() throws Exception {
        mockMvc.perform(get("/users")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .header(InboundRequestLoggingFilter.HEADER_REQUEST_ID, "req-42"))
                .andExpect(status().isOk());

        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals("203.0.113.9", entity.getIpAddress());
        Assertions.assertEquals("req-42", entity.getRequestId());
        Assertions.assertEquals("req-42", entity.getMetadata().get("request_id"));
    }

    @Test
    public void shouldParseFormBodies() throws Exception {
        mockMvc.perform(post("/users/search")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content("q=alice&pin=1234"))
                .andExpect(status().isOk())
                .andExpect(content().string("alice"));

        Map<?, ?> body = (Map<?, ?>) primary.lastRecord().getRequestBody();
        Assertions.assertEquals("alice", body.get("q"));
        Assertions.assertEquals(Constants.REDACTION_MARKER, body.get("pin"));
    }

    @Test
    public void shouldKeepQueryStringInUrl() throws Exception {
        mockMvc.perform(get("/users?page=2")).andExpect(status().isOk());

        Assertions.assertEquals("/users?page=2", primary.lastRecord().getUrl());
    }

    @Test
    public void shouldBoundCaptureForUnknownLengthBody() throws Exception {
        scope.configure(configuration -> configuration.setMaxBodySize(1_000));
        byte[] data = ("{\"blob\":\"" + "x".repeat(200_000) + "\"}").getBytes(StandardCharsets.UTF_8);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/uploads");
        request.setContentType(MediaType.APPLICATION_JSON_VALUE);
        request.setContent(data);
        AtomicReference<HttpServletRequest> seen = new AtomicReference<>();
        AtomicReference<byte[]> handlerBody = new AtomicReference<>();

        filter.doFilter(unknownLength(request), new MockHttpServletResponse(), (req, res) -> {
            seen.set((HttpServletRequest) req);
            handlerBody.set(StreamUtils.copyToByteArray(req.getInputStream()));
        });

        Assertions.assertArrayEquals(data, handlerBody.get());
        Assertions.assertTrue(seen.get() instanceof CachedBodyHttpServletRequest);
        Assertions.assertEquals(1_001, ((CachedBodyHttpServletRequest) seen.get()).getCachedBody().length);
        InboundRequestLogEntity entity = primary.lastRecord();
        Assertions.assertEquals("/uploads", entity.getUrl());
        Assertions.assertNull(entity.getRequestBody());
    }

    @Test
    public void shouldKeepRequestBodyForHandlerWhenCaptureFails() throws Exception {
        byte[] data = "{\"name\":\"alice\"}".getBytes(StandardCharsets.UTF_8);
        InterruptedServletInputStream stream = new InterruptedServletInputStream(data, 4);
        HttpServletRequest request = new HttpServletRequestWrapper(new MockHttpServletRequest("POST", "/users")) {
            @Override
            public ServletInputStream getInputStream() {
                return stream;
            }
        };
        AtomicReference<String> handlerBody = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) ->
                handlerBody.set(StreamUtils.copyToString(req.getInputStream(), StandardCharsets.UTF_8)));

        Assertions.assertEquals("{\"name\":\"alice\"}", handlerBody.get());
        Assertions.assertNull(primary.lastRecord().getRequestBody());
        verify(logger).error(eq("HTTP_CAPTURE_ERROR stage={}, errorType={}, errorMessage={}"),
                eq(CaptureStage.BODY_CAPTURED), eq("IOException"), eq("connection reset"));
    }

    private static HttpServletRequest unknownLength(HttpServletRequest request) {
        return new HttpServletRequestWrapper(request) {
            @Override
            public int getContentLength() {
                return -1;
            }

            @Override
            public long getContentLengthLong() {
                return -1L;
            }
        };
    }

    @RestController
    private static class UsersController {

        @GetMapping("/users")
        public Map<String, Object> index() {
            return Map.of("success", true);
        }

        @PostMapping("/users")
        public ResponseEntity<Map<String, Object>> create(@RequestBody Map<String, Object> body) {
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("name", body.get("name")));
        }

        @GetMapping(value = "/users/page", produces = MediaType.TEXT_HTML_VALUE)
        public String page() {
            return "<html><body>users</body></html>";
        }

        @GetMapping("/users/7")
        public Map<String, Object> show() {
            RequestLogContextHolder.setLoggable(LoggableReference.of("User", 7L));
            RequestLogContextHolder.addMetadata(Map.of("feature", "lookup"));
            return Map.of("id", 7);
        }

        @GetMapping("/users/boom")
        public Map<String, Object> boom() {
            RequestLogContextHolder.addMetadata(Map.of("feature", "boom"));
            throw new IllegalStateException("handler failed");
        }

        @PostMapping("/users/7/archive")
        public ResponseEntity<Void> archive() {
            return ResponseEntity.noContent().build();
        }

        @PostMapping(value = "/users/search", produces = MediaType.TEXT_PLAIN_VALUE)
        public String search(@RequestParam("q") String q) {
            return q;
        }
    }

    @RestController
    private static class HealthController {

        @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
        public String health() {
            return "ok";
        }
    }

    /**
     * 每次读取推进固定毫秒数。
     */
    private static class SteppingTicker extends Ticker {

        private final long stepNanos;
        private long current;

        private SteppingTicker(long stepMillis) {
            this.stepNanos = TimeUnit.MILLISECONDS.toNanos(stepMillis);
        }

        @Override
        public synchronized long read() {
            long value = current;
            current += stepNanos;
            return value;
        }
    }
}
