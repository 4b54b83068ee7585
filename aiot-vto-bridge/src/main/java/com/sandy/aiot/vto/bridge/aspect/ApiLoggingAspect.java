package com.sandy.aiot.vto.bridge.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every call into the bridge's REST controllers. Account keys are masked, they are
 * broker credentials.
 */
@Aspect
@Component
@Slf4j
public class ApiLoggingAspect {

    private static final String ACCOUNT_KEY_PARAM = "accountKey";

    private final ObjectMapper objectMapper;
    private final int maxBodyChars;

    public ApiLoggingAspect(ObjectMapper objectMapper,
                            @Value("${bridge.api.log-max-chars:2000}") int maxBodyChars) {
        this.objectMapper = objectMapper;
        this.maxBodyChars = maxBodyChars;
    }

    @Around("within(com.sandy.aiot.vto.bridge.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? maskUri(request.getRequestURI(), pjp) : "";

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();
        Map<String, Object> argMap = collectArgs(sig, pjp.getArgs());
        log.info("API Request: method={} uri={} handler={} args={}", method, uri, handler, toJson(argMap));

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error != null) {
                log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                        method, uri, handler, cost, error.getClass().getSimpleName(), error.getMessage());
            } else if (result instanceof ResponseEntity<?> re) {
                log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}",
                        method, uri, handler, re.getStatusCode(), cost, toJson(re.getBody()));
            } else {
                log.info("API Response: method={} uri={} handler={} durationMs={} result={}",
                        method, uri, handler, cost, toJson(result));
            }
        }
    }

    private Map<String, Object> collectArgs(MethodSignature sig, Object[] args) {
        String[] paramNames = sig.getParameterNames();
        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, ACCOUNT_KEY_PARAM.equals(name) && a instanceof String key ? BemfaAccount.maskKey(key) : a);
        }
        return argMap;
    }

    private String maskUri(String uri, ProceedingJoinPoint pjp) {
        String[] paramNames = ((MethodSignature) pjp.getSignature()).getParameterNames();
        Object[] args = pjp.getArgs();
        if (paramNames == null) return uri;
        for (int i = 0; i < paramNames.length && i < args.length; i++) {
            if (ACCOUNT_KEY_PARAM.equals(paramNames[i]) && args[i] instanceof String key && !key.isEmpty()) {
                uri = uri.replace(key, BemfaAccount.maskKey(key));
            }
        }
        return uri;
    }

    String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > maxBodyChars) {
                return s.substring(0, maxBodyChars) + "...(" + (s.length() - maxBodyChars) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
