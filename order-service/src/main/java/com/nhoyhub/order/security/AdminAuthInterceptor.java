package com.nhoyhub.order.security;

import com.nhoyhub.order.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs {@link AuthService#authorize} before every {@link AdminOnly} handler. A rejected token
 * surfaces as an {@code UnauthorizedException} and never reaches the controller.
 */
@Component
@RequiredArgsConstructor
public class AdminAuthInterceptor implements HandlerInterceptor {

    private final AuthService authService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (handler instanceof HandlerMethod method && method.hasMethodAnnotation(AdminOnly.class)) {
            authService.authorize(request.getHeader(HttpHeaders.AUTHORIZATION));
        }
        return true;
    }
}
