package com.inboundlogger.infrastructure.connection;

import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;
import com.inboundlogger.infrastructure.typehandler.CompatibleLocalDateTimeTypeHandler;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.ConfigurationException;
import com.inboundlogger.types.exception.ConnectionUnavailableException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.ibatis.mapping.VendorDatabaseIdProvider;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.SqlSessionFactoryBean;
import org.mybatis.spring.SqlSessionTemplate;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 命名连接注册表。
 * <p>
 * 每个名称持有独立的 Hikari 连接池与 MyBatis SqlSessionFactory，与宿主应用的连接池互不影响。
 * 同名同连接串重复注册时复用已有连接；连接串变化时替换并关闭旧连接池。
 * </p>
 */
@Slf4j
@Component
public class NamedConnectionRegistry {

    public static final String MAPPER_LOCATIONS = "classpath*:mybatis/mapper/*.xml";

    private final Map<String, NamedConnection> connections = new ConcurrentHashMap<>();

    /**
     * 注册命名连接并确保日志表存在。
     */
    public synchronized void register(String name, StorageLocation location) {
        if (name == null || location == null) {
            throw new ConfigurationException("Connection name and location are required");
        }
        NamedConnection existing = connections.get(name);
        if (existing != null) {
            if (existing.pointsTo(location)) {
                return;
            }
            connections.remove(name);
            existing.close();
            log.info("NAMED_CONNECTION_REPLACED name={}, location={}", name, location.describe());
        }
        HikariDataSource dataSource = createDataSource(name, location);
        try {
            createSchema(dataSource, location.getKind());
            InboundRequestLogDao dao = createDao(dataSource);
            connections.put(name, new NamedConnection(location, dataSource, dao));
            log.info("NAMED_CONNECTION_REGISTERED name={}, location={}", name, location.describe());
        } catch (RuntimeException ex) {
            dataSource.close();
            throw ex;
        }
    }

    /**
     * 解析命名连接的 DAO，不存在时抛出 ConnectionUnavailableException。
     */
    public InboundRequestLogDao dao(String name) {
        NamedConnection connection = connections.get(name);
        if (connection == null || connection.dataSource.isClosed()) {
            throw new ConnectionUnavailableException(name, "Named connection is not available: " + name);
        }
        return connection.dao;
    }

    /**
     * 解析命名连接的 DAO，并校验该名称当前仍指向 expected；名称已被替换到其他位置时抛出
     * ConnectionUnavailableException，持有旧位置的调用方不会写入新位置。
     */
    public InboundRequestLogDao dao(String name, StorageLocation expected) {
        NamedConnection connection = connections.get(name);
        if (connection == null || connection.dataSource.isClosed()) {
            throw new ConnectionUnavailableException(name, "Named connection is not available: " + name);
        }
        if (expected != null && !connection.pointsTo(expected)) {
            throw new ConnectionUnavailableException(name,
                    "Named connection " + name + " now points to " + connection.location.describe());
        }
        return connection.dao;
    }

    public boolean isRegistered(String name) {
        return connections.containsKey(name);
    }

    public synchronized void release(String name) {
        NamedConnection connection = connections.remove(name);
        if (connection != null) {
            connection.close();
            log.info("NAMED_CONNECTION_RELEASED name={}", name);
        }
    }

    @PreDestroy
    public synchronized void closeAll() {
        connections.values().forEach(NamedConnection::close);
        connections.clear();
    }

    private HikariDataSource createDataSource(String name, StorageLocation location) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(name);
        config.setJdbcUrl(location.getJdbcUrl());
        config.setDriverClassName(location.getKind().getDriverClassName());
        if (location.getUsername() != null) {
            config.setUsername(location.getUsername());
        }
        if (location.getPassword() != null) {
            config.setPassword(location.getPassword());
        }
        if (location.getKind() == StorageAdapterKind.SQLITE) {
            // 单写者
            config.setMaximumPoolSize(1);
            config.setConnectionInitSql("PRAGMA busy_timeout = 5000");
        } else {
            config.setMaximumPoolSize(5);
            config.setConnectionTimeout(5000L);
        }
        try {
            return new HikariDataSource(config);
        } catch (RuntimeException ex) {
            throw new ConnectionUnavailableException(name,
                    "Failed to open named connection " + name + " at " + location.describe(), ex);
        }
    }

    private void createSchema(HikariDataSource dataSource, StorageAdapterKind kind) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(
                new ClassPathResource("sql/inbound_request_logs_" + kind.getValue() + ".sql"));
        populator.setContinueOnError(false);
        populator.execute(dataSource);
    }

    private InboundRequestLogDao createDao(HikariDataSource dataSource) {
        SqlSessionFactoryBean factoryBean = new SqlSessionFactoryBean();
        factoryBean.setDataSource(dataSource);
        factoryBean.setDatabaseIdProvider(databaseIdProvider());
        factoryBean.setTypeHandlers(new CompatibleLocalDateTimeTypeHandler());
        try {
            factoryBean.setMapperLocations(new PathMatchingResourcePatternResolver().getResources(MAPPER_LOCATIONS));
            SqlSessionFactory sqlSessionFactory = factoryBean.getObject();
            return new SqlSessionTemplate(sqlSessionFactory).getMapper(InboundRequestLogDao.class);
        } catch (Exception ex) {
            throw new ConfigurationException("Failed to build MyBatis session factory for named connection", ex);
        }
    }

    /**
     * 宿主与命名连接共用的 databaseId 映射。
     */
    public static VendorDatabaseIdProvider databaseIdProvider() {
        Properties properties = new Properties();
        properties.setProperty("PostgreSQL", StorageAdapterKind.POSTGRESQL.getValue());
        properties.setProperty("SQLite", StorageAdapterKind.SQLITE.getValue());
        VendorDatabaseIdProvider provider = new VendorDatabaseIdProvider();
        provider.setProperties(properties);
        return provider;
    }

    private static final class NamedConnection {

        private final StorageLocation location;
        private final HikariDataSource dataSource;
        private final InboundRequestLogDao dao;

        private NamedConnection(StorageLocation location, HikariDataSource dataSource, InboundRequestLogDao dao) {
            this.location = location;
            this.dataSource = dataSource;
            this.dao = dao;
        }

        private boolean pointsTo(StorageLocation other) {
            return Objects.equals(location.getJdbcUrl(), other.getJdbcUrl())
                    && Objects.equals(location.getUsername(), other.getUsername());
        }

        private void close() {
            dataSource.close();
        }
    }
}
