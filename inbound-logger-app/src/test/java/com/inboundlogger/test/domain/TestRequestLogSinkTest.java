package com.inboundlogger.test.domain;

import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.service.TestRequestLogSink;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.StorageAdapterKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TestRequestLogSinkTest {

    private IStorageAdapterFactory factory;
    private IRequestLogStorageAdapter adapter;
    private TestRequestLogSink sink;

    @BeforeEach
    public void setUp() {
        factory = mock(IStorageAdapterFactory.class);
        adapter = mock(IRequestLogStorageAdapter.class);
        when(adapter.available()).thenReturn(true);
        when(factory.create(eq(StorageAdapterKind.SQLITE), anyString(), eq(Constants.TEST_CONNECTION_NAME))).thenReturn(adapter);
        sink = new TestRequestLogSink(factory);
    }

    @Test
    public void shouldReturnEmptyResultsWhenDisabled() {
        Assertions.assertFalse(sink.isEnabled());
        Assertions.assertEquals(0L, sink.logsCount());
        Assertions.assertEquals(0L, sink.logsWithStatus(200));
        Assertions.assertTrue(sink.allLogs().isEmpty());
        Assertions.assertEquals(0L, sink.analyze().getTotalRequests());
        Assertions.assertNull(sink.logRequest(null, null));
        verify(factory, never()).create(eq(StorageAdapterKind.SQLITE), anyString(), anyString());
    }

    @Test
    public void shouldUseDefaultLocationOnEnable() {
        sink.enable();

        Assertions.assertTrue(sink.isEnabled());
        verify(factory).create(StorageAdapterKind.SQLITE, TestRequestLogSink.DEFAULT_SQLITE_LOCATION, Constants.TEST_CONNECTION_NAME);
        verify(adapter).establishConnection();
    }

    @Test
    public void shouldDelegateQueriesWhenEnabled() {
        InboundRequestLogEntity entity = new InboundRequestLogEntity();
        entity.setHttpMethod("GET");
        entity.setUrl("/users");
        when(adapter.count()).thenReturn(3L);
        when(adapter.countWithStatus(404)).thenReturn(1L);
        when(adapter.countForPath("/users")).thenReturn(2L);
        when(adapter.findAll()).thenReturn(List.of(entity));
        sink.configure("tmp/custom.sqlite3", StorageAdapterKind.SQLITE);
        sink.enable();

        Assertions.assertEquals(3L, sink.logsCount());
        Assertions.assertEquals(1L, sink.logsWithStatus(404));
        Assertions.assertEquals(2L, sink.logsForPath("/users"));
        Assertions.assertEquals(List.of("GET /users"), sink.allCalls());
        verify(factory).create(StorageAdapterKind.SQLITE, "tmp/custom.sqlite3", Constants.TEST_CONNECTION_NAME);
    }

    @Test
    public void shouldClearAndDisableOnReset() {
        sink.enable();

        sink.reset();

        verify(adapter).clear();
        Assertions.assertFalse(sink.isEnabled());
    }
}
