package com.inboundlogger.trigger.http;

import com.inboundlogger.api.dto.CleanupResponseDTO;
import com.inboundlogger.api.dto.LoggerStatusDTO;
import com.inboundlogger.api.dto.RequestLogAnalysisDTO;
import com.inboundlogger.api.dto.RequestLogDTO;
import com.inboundlogger.api.dto.SecondarySinkRequestDTO;
import com.inboundlogger.api.response.Response;
import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.RequestLogAnalysis;
import com.inboundlogger.domain.log.model.valobj.RequestLogSearchCriteria;
import com.inboundlogger.domain.log.service.InboundHttpLogger;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.InboundLoggerException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 请求日志管理 API：检索、统计、清理、开关与辅助 sink 配置。
 */
@RestController
@RequestMapping("/admin/inbound-logs")
public class RequestLogAdminController {

    private final InboundHttpLogger inboundHttpLogger;

    public RequestLogAdminController(InboundHttpLogger inboundHttpLogger) {
        this.inboundHttpLogger = inboundHttpLogger;
    }

    @GetMapping
    public Response<List<RequestLogDTO>> search(
            @RequestParam(value = "q", required = false) String q,
            @RequestParam(value = "status", required = false) List<Integer> statuses,
            @RequestParam(value = "method", required = false) List<String> methods,
            @RequestParam(value = "ipAddress", required = false) String ipAddress,
            @RequestParam(value = "loggableType", required = false) String loggableType,
            @RequestParam(value = "loggableId", required = false) Long loggableId,
            @RequestParam(value = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "limit", required = false) Integer limit) {
        RequestLogSearchCriteria criteria = RequestLogSearchCriteria.builder()
                .q(q)
                .statuses(statuses)
                .methods(methods)
                .ipAddress(ipAddress)
                .loggableType(loggableType)
                .loggableId(loggableId)
                .startDate(startDate)
                .endDate(endDate)
                .limit(limit)
                .build();
        List<RequestLogDTO> items = inboundHttpLogger.search(criteria).stream()
                .map(this::toDTO)
                .collect(Collectors.toList());
        return success(items);
    }

    @GetMapping("/analysis")
    public Response<RequestLogAnalysisDTO> analysis() {
        return success(toDTO(inboundHttpLogger.analyze()));
    }

    @DeleteMapping
    public Response<CleanupResponseDTO> cleanup(@RequestParam(value = "olderThanDays", required = false) Integer olderThanDays) {
        int days = olderThanDays == null ? Constants.DEFAULT_RETENTION_DAYS : olderThanDays;
        int deleted = inboundHttpLogger.cleanup(days);
        return success(new CleanupResponseDTO(days, deleted));
    }

    @GetMapping("/status")
    public Response<LoggerStatusDTO> status() {
        return success(toStatus(inboundHttpLogger.configuration()));
    }

    @PostMapping("/enable")
    public Response<LoggerStatusDTO> enable() {
        inboundHttpLogger.enable();
        return success(toStatus(inboundHttpLogger.configuration()));
    }

    @PostMapping("/disable")
    public Response<LoggerStatusDTO> disable() {
        inboundHttpLogger.disable();
        return success(toStatus(inboundHttpLogger.configuration()));
    }

    @PutMapping("/secondary-sink")
    public Response<LoggerStatusDTO> enableSecondarySink(@RequestBody SecondarySinkRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getLocation())) {
            throw new InboundLoggerException(ErrorCode.ILLEGAL_PARAMETER.getCode(), "location不能为空");
        }
        StorageAdapterKind kind = StorageAdapterKind.fromValue(StringUtils.defaultIfBlank(request.getAdapter(),
                StorageAdapterKind.SQLITE.getValue()));
        inboundHttpLogger.enableSecondarySink(request.getLocation(), kind);
        return success(toStatus(inboundHttpLogger.configuration()));
    }

    @DeleteMapping("/secondary-sink")
    public Response<LoggerStatusDTO> disableSecondarySink() {
        inboundHttpLogger.disableSecondarySink();
        return success(toStatus(inboundHttpLogger.configuration()));
    }

    private RequestLogDTO toDTO(InboundRequestLogEntity entity) {
        RequestLogDTO dto = new RequestLogDTO();
        dto.setId(entity.getId());
        dto.setRequestId(entity.getRequestId());
        dto.setHttpMethod(entity.getHttpMethod());
        dto.setUrl(entity.getUrl());
        dto.setIpAddress(entity.getIpAddress());
        dto.setUserAgent(entity.getUserAgent());
        dto.setReferrer(entity.getReferrer());
        dto.setRequestHeaders(entity.getRequestHeaders());
        dto.setRequestBody(entity.getRequestBody());
        dto.setStatusCode(entity.getStatusCode());
        dto.setStatusText(entity.statusText());
        dto.setResponseHeaders(entity.getResponseHeaders());
        dto.setResponseBody(entity.getResponseBody());
        dto.setDurationMs(entity.getDurationMs());
        dto.setFormattedDuration(entity.formattedDuration());
        dto.setLoggableType(entity.getLoggableType());
        dto.setLoggableId(entity.getLoggableId());
        dto.setMetadata(entity.getMetadata());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }

    private RequestLogAnalysisDTO toDTO(RequestLogAnalysis analysis) {
        RequestLogAnalysisDTO dto = new RequestLogAnalysisDTO();
        dto.setTotalRequests(analysis.getTotalRequests());
        dto.setSuccessfulRequests(analysis.getSuccessfulRequests());
        dto.setClientErrorRequests(analysis.getClientErrorRequests());
        dto.setServerErrorRequests(analysis.getServerErrorRequests());
        dto.setSuccessRate(analysis.getSuccessRate());
        dto.setErrorRate(analysis.getErrorRate());
        return dto;
    }

    private LoggerStatusDTO toStatus(LoggerConfiguration configuration) {
        LoggerStatusDTO dto = new LoggerStatusDTO();
        dto.setEnabled(configuration.isEnabled());
        dto.setDebugLogging(configuration.isDebugLogging());
        dto.setMaxBodySize(configuration.getMaxBodySize());
        dto.setSecondarySinkEnabled(configuration.isSecondarySinkEnabled());
        if (configuration.getSecondarySink() != null) {
            dto.setSecondarySinkAdapter(configuration.getSecondarySink().getAdapterKind().getValue());
        }
        return dto;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ErrorCode.SUCCESS.getCode())
                .info(ErrorCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
