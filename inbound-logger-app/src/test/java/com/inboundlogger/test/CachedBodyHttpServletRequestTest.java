package com.inboundlogger.test;

import com.inboundlogger.test.support.InterruptedServletInputStream;
import com.inboundlogger.trigger.capture.CachedBodyHttpServletRequest;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class CachedBodyHttpServletRequestTest {

    @Test
    public void shouldCacheWholeBodyWithinLimit() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users");
        request.setContent("hello".getBytes(StandardCharsets.UTF_8));

        CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.capture(request, 10);

        Assertions.assertTrue(cached.isComplete());
        Assertions.assertNull(cached.getCaptureFailure());
        Assertions.assertEquals(5, cached.getContentLength());
        Assertions.assertEquals("hello", StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8));
        Assertions.assertEquals("hello", StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8));
    }

    @Test
    public void shouldBufferOnlyLimitPlusOneAndPassRestThrough() throws Exception {
        byte[] data = new byte[1_000_000];
        Arrays.fill(data, (byte) 'x');
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/upload");
        request.setContent(data);

        CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.capture(request, 100);

        Assertions.assertFalse(cached.isComplete());
        Assertions.assertEquals(101, cached.getCachedBody().length);
        Assertions.assertArrayEquals(data, StreamUtils.copyToByteArray(cached.getInputStream()));
    }

    @Test
    public void shouldHandOverPrefixAndRemainderAfterReadFailure() throws Exception {
        byte[] data = "{\"name\":\"alice\"}".getBytes(StandardCharsets.UTF_8);
        InterruptedServletInputStream stream = new InterruptedServletInputStream(data, 5);
        HttpServletRequestWrapper request = new HttpServletRequestWrapper(new MockHttpServletRequest("POST", "/users")) {
            @Override
            public ServletInputStream getInputStream() {
                return stream;
            }
        };

        CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.capture(request, 100);

        Assertions.assertNotNull(cached.getCaptureFailure());
        Assertions.assertFalse(cached.isComplete());
        Assertions.assertEquals(5, cached.getCachedBody().length);
        Assertions.assertArrayEquals(data, StreamUtils.copyToByteArray(cached.getInputStream()));
    }

    @Test
    public void shouldNotifyReadListenerForCachedBody() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users");
        request.setContent("abc".getBytes(StandardCharsets.UTF_8));
        ReadListener listener = mock(ReadListener.class);

        CachedBodyHttpServletRequest.capture(request, 10).getInputStream().setReadListener(listener);

        InOrder order = inOrder(listener);
        order.verify(listener).onDataAvailable();
        order.verify(listener).onAllDataRead();
        verify(listener, never()).onError(any());
    }

    @Test
    public void shouldSkipDataAvailableForEmptyBody() throws Exception {
        ReadListener listener = mock(ReadListener.class);

        CachedBodyHttpServletRequest.capture(new MockHttpServletRequest("GET", "/users"), 10)
                .getInputStream().setReadListener(listener);

        verify(listener, never()).onDataAvailable();
        verify(listener).onAllDataRead();
    }

    @Test
    public void shouldReportReadListenerFailure() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users");
        request.setContent("abc".getBytes(StandardCharsets.UTF_8));
        ReadListener listener = mock(ReadListener.class);
        IOException failure = new IOException("listener failed");
        doThrow(failure).when(listener).onDataAvailable();

        CachedBodyHttpServletRequest.capture(request, 10).getInputStream().setReadListener(listener);

        verify(listener).onError(failure);
        verify(listener, never()).onAllDataRead();
    }

    @Test
    public void shouldParseFormParametersBeyondLimit() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users/search");
        request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        request.setContent(("q=alice&note=" + "n".repeat(500)).getBytes(StandardCharsets.UTF_8));

        CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.capture(request, 10);

        Assertions.assertFalse(cached.isComplete());
        Assertions.assertEquals("alice", cached.getParameter("q"));
        Assertions.assertEquals(500, cached.getParameter("note").length());
    }
}
