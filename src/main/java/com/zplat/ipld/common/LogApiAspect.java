package com.zplat.ipld.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.time.Instant;

/**
 * Logs one line per call of a {@link LogApi} endpoint: method, uri, status, elapsed time and bodies.
 */
@Aspect
@Component
@Slf4j
public class LogApiAspect {

    private static final int MAX_BODY_LEN = 2000;

    private final ObjectMapper objectMapper;

    public LogApiAspect(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Around("@annotation(com.zplat.ipld.common.LogApi)")
    public Object logApiCall(ProceedingJoinPoint joinPoint) throws Throwable {
        Instant start = Instant.now();

        String endpoint = joinPoint.getSignature().toShortString();
        String httpMethod = "-";
        String ipAddress = "-";
        String query = null;
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes != null) {
            HttpServletRequest request = attributes.getRequest();
            endpoint = request.getRequestURI();
            httpMethod = request.getMethod();
            ipAddress = getClientIp(request);
            query = request.getQueryString();
        }

        Object[] args = joinPoint.getArgs();
        String requestBody = args.length > 0 ? toJson(args[0]) : null;
        String responseBody = null;
        int responseStatus = HttpStatus.OK.value();
        try {
            Object result = joinPoint.proceed();
            responseBody = toJson(result);
            return result;
        } catch (Exception e) {
            responseBody = e.getMessage();
            responseStatus = HttpStatus.INTERNAL_SERVER_ERROR.value();
            throw e;
        } finally {
            log.info("API {} {}{} from {} -> {} in {} ms, request={}, response={}",
                    httpMethod, endpoint, query == null ? "" : "?" + query, ipAddress, responseStatus,
                    Duration.between(start, Instant.now()).toMillis(), requestBody, responseBody);
        }
    }

    private String toJson(Object value) {
        try {
            String json = objectMapper.writeValueAsString(value);
            return json.length() > MAX_BODY_LEN ? json.substring(0, MAX_BODY_LEN) + "..." : json;
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private String getClientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("Proxy-Client-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip;
    }
}
