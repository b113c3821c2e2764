package com.keer.seating.auth;

import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link AdminGrant} controller parameters from the {@code Authorization} header.
 */
@Component
@RequiredArgsConstructor
public class AdminGrantArgumentResolver implements HandlerMethodArgumentResolver {

    private final AdminTokenVerifier verifier;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AdminGrant.class.equals(parameter.getParameterType());
    }

    @Override
    public AdminGrant resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                      NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return verifier.verify(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
    }
}
