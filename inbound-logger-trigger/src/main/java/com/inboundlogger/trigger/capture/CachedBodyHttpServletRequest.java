package com.inboundlogger.trigger.capture;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 读入请求体前缀并可重复读取的请求包装。
 * <p>
 * 最多读取 limit + 1 个字节：在上限内读到流末尾时请求体完整缓存，可重复读取；否则（超过上限或读取中途出错）
 * 下游拿到的输入流先返回已读的前缀，再接着读原始流的剩余部分，请求体不会丢失。
 * 表单请求的参数从完整请求体与查询串中解析，保证下游 getParameter 与 getInputStream 都能拿到数据。
 * </p>
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private static final int BUFFER_SIZE = 8192;

    private final byte[] body;
    private final boolean complete;
    private final IOException captureFailure;
    private final ServletInputStream original;
    private ServletInputStream passthrough;
    private Map<String, String[]> formParameters;

    private CachedBodyHttpServletRequest(HttpServletRequest request,
                                         byte[] body,
                                         boolean complete,
                                         IOException captureFailure,
                                         ServletInputStream original) {
        super(request);
        this.body = body;
        this.complete = complete;
        this.captureFailure = captureFailure;
        this.original = original;
    }

    /**
     * 读取至多 limit + 1 个字节。读取时的 IOException 不向外抛出，记录在 {@link #getCaptureFailure()} 中。
     */
    public static CachedBodyHttpServletRequest capture(HttpServletRequest request, int limit) {
        long max = (long) Math.max(limit, 0) + 1;
        ByteArrayOutputStream prefix = new ByteArrayOutputStream((int) Math.min(max, BUFFER_SIZE));
        ServletInputStream in = null;
        try {
            in = request.getInputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (prefix.size() < max) {
                int read = in.read(buffer, 0, (int) Math.min(buffer.length, max - prefix.size()));
                if (read == -1) {
                    return new CachedBodyHttpServletRequest(request, prefix.toByteArray(), true, null, in);
                }
                prefix.write(buffer, 0, read);
            }
            return new CachedBodyHttpServletRequest(request, prefix.toByteArray(), false, null, in);
        } catch (IOException ex) {
            return new CachedBodyHttpServletRequest(request, prefix.toByteArray(), false, ex, in);
        }
    }

    /**
     * 已读取的字节；{@link #isComplete()} 为 false 时只是请求体的前缀。
     */
    public byte[] getCachedBody() {
        return body;
    }

    /**
     * 是否在上限内读到了流末尾。
     */
    public boolean isComplete() {
        return complete;
    }

    public IOException getCaptureFailure() {
        return captureFailure;
    }

    public Charset resolveCharset() {
        String encoding = getCharacterEncoding();
        if (StringUtils.isBlank(encoding)) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException ex) {
            return StandardCharsets.UTF_8;
        }
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (complete) {
            return new CachedBodyServletInputStream(body);
        }
        if (original == null) {
            return super.getInputStream();
        }
        synchronized (this) {
            if (passthrough == null) {
                passthrough = new PrefixedServletInputStream(body, original);
            }
            return passthrough;
        }
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (complete) {
            return new BufferedReader(new InputStreamReader(new ByteArrayInputStream(body), resolveCharset()));
        }
        return new BufferedReader(new InputStreamReader(getInputStream(), resolveCharset()));
    }

    @Override
    public int getContentLength() {
        return complete ? body.length : super.getContentLength();
    }

    @Override
    public long getContentLengthLong() {
        return complete ? body.length : super.getContentLengthLong();
    }

    @Override
    public String getParameter(String name) {
        if (!isFormPost()) {
            return super.getParameter(name);
        }
        String[] values = formParameters().get(name);
        return values == null || values.length == 0 ? null : values[0];
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        if (!isFormPost()) {
            return super.getParameterMap();
        }
        return Collections.unmodifiableMap(formParameters());
    }

    @Override
    public Enumeration<String> getParameterNames() {
        if (!isFormPost()) {
            return super.getParameterNames();
        }
        return Collections.enumeration(formParameters().keySet());
    }

    @Override
    public String[] getParameterValues(String name) {
        if (!isFormPost()) {
            return super.getParameterValues(name);
        }
        return formParameters().get(name);
    }

    private boolean isFormPost() {
        String contentType = getContentType();
        return (!complete || body.length > 0) && contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
    }

    private synchronized Map<String, String[]> formParameters() {
        if (formParameters == null) {
            Map<String, String[]> merged = new LinkedHashMap<>();
            Charset charset = resolveCharset();
            byte[] formBody = complete ? body : readPassthrough();
            try {
                merge(merged, FormBodyParser.parseMultiValue(getQueryString(), StandardCharsets.UTF_8));
                merge(merged, FormBodyParser.parseMultiValue(new String(formBody, charset), charset));
            } catch (IllegalArgumentException ex) {
                merged = new LinkedHashMap<>(super.getParameterMap());
            }
            formParameters = merged;
        }
        return formParameters;
    }

    private byte[] readPassthrough() {
        try {
            return StreamUtils.copyToByteArray(getInputStream());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read form parameters from request body", ex);
        }
    }

    private static void merge(Map<String, String[]> target, Map<String, List<String>> source) {
        source.forEach((key, values) -> {
            String[] existing = target.get(key);
            if (existing == null) {
                target.put(key, values.toArray(new String[0]));
            } else {
                String[] combined = new String[existing.length + values.size()];
                System.arraycopy(existing, 0, combined, 0, existing.length);
                for (int i = 0; i < values.size(); i++) {
                    combined[existing.length + i] = values.get(i);
                }
                target.put(key, combined);
            }
        });
    }

    private static final class CachedBodyServletInputStream extends ServletInputStream {

        private final ByteArrayInputStream delegate;

        private CachedBodyServletInputStream(byte[] body) {
            this.delegate = new ByteArrayInputStream(body);
        }

        @Override
        public boolean isFinished() {
            return delegate.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        /**
         * 数据已全部在内存中，注册时立即回调。
         */
        @Override
        public void setReadListener(ReadListener readListener) {
            try {
                if (!isFinished()) {
                    readListener.onDataAvailable();
                }
                readListener.onAllDataRead();
            } catch (IOException ex) {
                readListener.onError(ex);
            }
        }

        @Override
        public int read() {
            return delegate.read();
        }

        @Override
        public int read(byte[] b, int off, int len) {
            return delegate.read(b, off, len);
        }
    }

    /**
     * 先返回已读前缀，再读原始流剩余部分。
     */
    private static final class PrefixedServletInputStream extends ServletInputStream {

        private final ByteArrayInputStream prefix;
        private final ServletInputStream remainder;

        private PrefixedServletInputStream(byte[] prefix, ServletInputStream remainder) {
            this.prefix = new ByteArrayInputStream(prefix);
            this.remainder = remainder;
        }

        @Override
        public boolean isFinished() {
            return prefix.available() == 0 && remainder.isFinished();
        }

        @Override
        public boolean isReady() {
            return prefix.available() > 0 || remainder.isReady();
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            remainder.setReadListener(readListener);
        }

        @Override
        public int read() throws IOException {
            int value = prefix.read();
            return value != -1 ? value : remainder.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (prefix.available() > 0) {
                return prefix.read(b, off, len);
            }
            return remainder.read(b, off, len);
        }
    }
}
