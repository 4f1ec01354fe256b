package com.poufmaker.api.dto;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * Where a request came from, as recorded in sessions and login history.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    public static final ClientInfo UNKNOWN = new ClientInfo("unknown", null);

    public static ClientInfo from(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String ipAddress;
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            ipAddress = forwardedFor.split(",")[0].trim();
        } else if (request.getHeader("X-Real-IP") != null) {
            ipAddress = request.getHeader("X-Real-IP");
        } else if (request.getRemoteAddr() != null) {
            ipAddress = request.getRemoteAddr();
        } else {
            ipAddress = UNKNOWN.ipAddress();
        }
        return new ClientInfo(ipAddress, request.getHeader(HttpHeaders.USER_AGENT));
    }
}
