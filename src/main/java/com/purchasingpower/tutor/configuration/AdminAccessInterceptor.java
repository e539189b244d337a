package com.purchasingpower.tutor.configuration;

import com.purchasingpower.tutor.exception.AuthorizationException;
import com.purchasingpower.tutor.model.dto.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Admin gate for the reporting endpoints. Runs before request parameters are bound,
 * so a non-admin caller gets 403 whatever filters were sent.
 */
@Slf4j
public class AdminAccessInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        CallerIdentity caller = CallerIdentityArgumentResolver.fromHeaders(
                request.getHeader(CallerIdentityArgumentResolver.USER_ID_HEADER),
                request.getHeader(CallerIdentityArgumentResolver.ADMIN_HEADER));
        if (!caller.admin()) {
            log.warn("User {} denied access to {}", caller.userId(), request.getRequestURI());
            throw new AuthorizationException("Admin access required");
        }
        return true;
    }
}
