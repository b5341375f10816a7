package com.inboundlogger.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 作为日志配置的缓存句柄，保存按连接串创建的辅助 sink 适配器。
 * 过期后重建的适配器会复用命名连接注册表中的同名连接池。
 * </p>
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "cache")
    public Cache<String, Object> cache() {
        return CacheBuilder.newBuilder()
                .expireAfterAccess(30, TimeUnit.MINUTES)
                .maximumSize(16)
                .build();
    }

}
