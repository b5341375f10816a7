package com.inboundlogger.config;

import com.inboundlogger.domain.log.service.InboundHttpLogger;
import com.inboundlogger.domain.log.service.TestRequestLogSink;
import com.inboundlogger.types.enums.StorageAdapterKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * 启动时按配置启用辅助 sink 与测试 sink。连接串非法时启动失败。
 */
@Slf4j
@Component
public class InboundLoggerInitializer implements SmartInitializingSingleton {

    private final InboundLoggerProperties properties;
    private final InboundHttpLogger inboundHttpLogger;
    private final TestRequestLogSink testRequestLogSink;

    public InboundLoggerInitializer(InboundLoggerProperties properties,
                                    InboundHttpLogger inboundHttpLogger,
                                    TestRequestLogSink testRequestLogSink) {
        this.properties = properties;
        this.inboundHttpLogger = inboundHttpLogger;
        this.testRequestLogSink = testRequestLogSink;
    }

    @Override
    public void afterSingletonsInstantiated() {
        InboundLoggerProperties.Secondary secondary = properties.getSecondary();
        if (StringUtils.isNotBlank(secondary.getLocation())) {
            inboundHttpLogger.enableSecondarySink(secondary.getLocation(), StorageAdapterKind.fromValue(secondary.getAdapter()));
        }
        InboundLoggerProperties.TestSink testSink = properties.getTestSink();
        if (testSink.isEnabled()) {
            testRequestLogSink.configure(testSink.getLocation(), StorageAdapterKind.fromValue(testSink.getAdapter()));
            testRequestLogSink.enable();
        }
        log.info("INBOUND_LOGGER_READY enabled={}, secondarySink={}, testSink={}",
                inboundHttpLogger.isEnabled(), inboundHttpLogger.isSecondarySinkEnabled(), testRequestLogSink.isEnabled());
    }
}
