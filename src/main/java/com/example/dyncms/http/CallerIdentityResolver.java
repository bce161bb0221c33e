package com.example.dyncms.http;

import com.example.dyncms.service.CallerIdentity;
import com.example.dyncms.service.CmsException;
import com.example.dyncms.service.Role;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link CallerIdentity} for handler methods that declare one. The identity headers
 * are set by the gateway after authentication; a request without a user id is rejected.
 */
@Component
public class CallerIdentityResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            throw CmsException.unauthenticated();
        }
        return new CallerIdentity(userId.trim(), Role.fromHeader(webRequest.getHeader(ROLE_HEADER)));
    }
}
