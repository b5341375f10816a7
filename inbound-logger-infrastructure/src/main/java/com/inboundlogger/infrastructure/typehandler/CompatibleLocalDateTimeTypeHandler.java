package com.inboundlogger.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * 兼容 PostgreSQL TIMESTAMP 与 SQLite 毫秒整数的 LocalDateTime 映射处理器。
 * <p>
 * 写入统一走 setTimestamp：PostgreSQL 落为 TIMESTAMP，sqlite-jdbc 落为毫秒时间戳，比较条件与写入保持同一编码。
 * </p>
 */
@MappedTypes(LocalDateTime.class)
public class CompatibleLocalDateTimeTypeHandler extends BaseTypeHandler<LocalDateTime> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalDateTime parameter, JdbcType jdbcType) throws SQLException {
        ps.setTimestamp(i, Timestamp.valueOf(parameter));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toLocalDateTime(rs.getObject(columnName));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toLocalDateTime(rs.getObject(columnIndex));
    }

    @Override
    public LocalDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toLocalDateTime(cs.getObject(columnIndex));
    }

    private LocalDateTime toLocalDateTime(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        // sqlite-jdbc 默认以毫秒整数存储时间
        if (value instanceof Number number) {
            return new Timestamp(number.longValue()).toLocalDateTime();
        }
        if (value instanceof String text) {
            try {
                return Timestamp.valueOf(text.trim()).toLocalDateTime();
            } catch (IllegalArgumentException ex) {
                try {
                    return LocalDateTime.parse(text.trim());
                } catch (DateTimeParseException parseEx) {
                    throw new SQLException("Unsupported datetime text: " + text, parseEx);
                }
            }
        }
        throw new SQLException("Unsupported datetime value type: " + value.getClass().getName());
    }
}
