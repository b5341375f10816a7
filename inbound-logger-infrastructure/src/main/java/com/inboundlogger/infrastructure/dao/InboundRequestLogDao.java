package com.inboundlogger.infrastructure.dao;

import com.inboundlogger.infrastructure.dao.po.InboundRequestLogPO;
import com.inboundlogger.infrastructure.dao.po.RequestLogQueryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 入站请求日志 DAO
 * <p>
 * SQL 按 databaseId（postgresql / sqlite）区分方言。
 * </p>
 *
 * @since 2026-10-17
 */
@Mapper
public interface InboundRequestLogDao {

    /**
     * 插入日志
     */
    int insert(InboundRequestLogPO po);

    /**
     * 条件检索，按创建时间倒序
     */
    List<InboundRequestLogPO> search(RequestLogQueryPO query);

    /**
     * 删除早于截止时间的记录
     */
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);

    /**
     * 删除全部记录
     */
    int deleteAll();

    long countAll();

    long countByStatus(@Param("statusCode") Integer statusCode);

    long countByStatusBetween(@Param("fromStatus") Integer fromStatus, @Param("toStatus") Integer toStatus);

    long countByUrlPattern(@Param("urlPattern") String urlPattern);

    List<InboundRequestLogPO> selectAll();

    /**
     * 响应体包含指定键值
     *
     * @param jsonPath SQLite 使用的 JSON 路径
     * @param containment PostgreSQL 使用的 JSON 片段
     */
    List<InboundRequestLogPO> selectByResponseContaining(@Param("jsonPath") String jsonPath,
                                                         @Param("value") Object value,
                                                         @Param("containment") String containment);

    List<InboundRequestLogPO> selectByRequestContaining(@Param("jsonPath") String jsonPath,
                                                        @Param("value") Object value,
                                                        @Param("containment") String containment);
}
