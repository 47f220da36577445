package com.pairup.server.im.web;

import com.alibaba.fastjson.JSONObject;
import com.pairup.server.im.auth.TokenVerifier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;

/**
 * Resolves the bearer token of an API request to the calling user, exposed to handlers as the
 * {@value #USER_ID_ATTRIBUTE} request attribute.
 */
@Component
public class AuthInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthInterceptor.class);

    public static final String USER_ID_ATTRIBUTE = "userId";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;

    public AuthInterceptor(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        OptionalLong userId = OptionalLong.empty();
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            userId = tokenVerifier.verify(header.substring(BEARER_PREFIX.length()).trim());
        }
        if (userId.isEmpty()) {
            log.debug("Unauthenticated request to {}", request.getRequestURI());
            JSONObject body = new JSONObject();
            body.put("error", "UNAUTHORIZED");
            body.put("message", "missing or invalid token");
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.getWriter().write(body.toJSONString());
            return false;
        }
        request.setAttribute(USER_ID_ATTRIBUTE, userId.getAsLong());
        return true;
    }
}
