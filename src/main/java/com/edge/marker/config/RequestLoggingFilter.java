package com.edge.marker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_BODY_LOG = 1000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();

        // 导出文件下载不缓存
        if (path.startsWith("/api/exports/")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        try {
            logger.info(">>> {} {}", request.getMethod(), path);
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT")) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.info("Request Body: {}", truncate(new String(content, StandardCharsets.UTF_8)));
                }
            }

            // 轨迹 JSON 可能很大，只打印长度
            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = response.getContentType();
            if (responseContent.length > 0 && contentType != null && contentType.contains("json")) {
                logger.debug("Response Body ({} bytes): {}", responseContent.length,
                    truncate(new String(responseContent, StandardCharsets.UTF_8)));
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("<<< {} {} | {} ms | Status: {}", request.getMethod(), path, duration, response.getStatus());
        }
    }

    private static String truncate(String body) {
        return body.length() > MAX_BODY_LOG ? body.substring(0, MAX_BODY_LOG) + "..." : body;
    }
}
