package com.inboundlogger.config;

import com.inboundlogger.infrastructure.connection.NamedConnectionRegistry;
import org.apache.ibatis.mapping.DatabaseIdProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 宿主数据源的 MyBatis 方言识别，与命名连接使用同一映射。
 */
@Configuration
public class MyBatisConfig {

    @Bean
    public DatabaseIdProvider databaseIdProvider() {
        return NamedConnectionRegistry.databaseIdProvider();
    }
}
