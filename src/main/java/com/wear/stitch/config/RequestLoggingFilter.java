package com.wear.stitch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 请求日志
 * <p>
 * 拼接请求体为 Base64 图像，不记录请求体；JSON 响应超过 2000 字符时截断。
 * 图片静态资源直接放行。
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_LOGGED_BODY = 2000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();
        if (path.startsWith("/api/images/")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long startTime = System.currentTimeMillis();

        try {
            logger.info(">>> {} {} ({} bytes)", request.getMethod(), path, request.getContentLengthLong());
            filterChain.doFilter(request, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            String contentType = responseWrapper.getContentType();
            byte[] content = responseWrapper.getContentAsByteArray();
            if (content.length > 0 && contentType != null && contentType.contains("json")) {
                String body = new String(content, StandardCharsets.UTF_8);
                if (body.length() > MAX_LOGGED_BODY) {
                    body = body.substring(0, MAX_LOGGED_BODY) + "...";
                }
                logger.debug("Response Body: {}", body);
            }

            // 必须把缓存的响应体写回，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();
            logger.info("<<< {} {} | Status: {} | {} ms", request.getMethod(), path, response.getStatus(), duration);
        }
    }
}
