package com.purchasingpower.tutor.configuration;

import com.purchasingpower.tutor.exception.AuthenticationRequiredException;
import com.purchasingpower.tutor.model.dto.CallerIdentity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Reads the caller asserted by the gateway from {@value #USER_ID_HEADER} and {@value #ADMIN_HEADER}.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ADMIN_HEADER = "X-User-Admin";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        return fromHeaders(webRequest.getHeader(USER_ID_HEADER), webRequest.getHeader(ADMIN_HEADER));
    }

    static CallerIdentity fromHeaders(String userId, String adminFlag) {
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationRequiredException("Authentication required");
        }
        long parsed;
        try {
            parsed = Long.parseLong(userId.trim());
        } catch (NumberFormatException e) {
            throw new AuthenticationRequiredException("Invalid user identity");
        }
        return new CallerIdentity(parsed, Boolean.parseBoolean(adminFlag));
    }
}
