package com.flagship.drink_ledger.web;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.config.LedgerProperties;
import com.flagship.drink_ledger.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the {@link LedgerPrincipal} of a request from the identity headers
 * set by the authenticating reverse proxy.
 *
 * Resolves to null for anonymous requests; the authorization gate decides
 * whether that is acceptable for the operation. When trusted proxies are
 * configured, headers arriving from any other peer are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    private final LedgerProperties properties;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return LedgerPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        LedgerProperties.Identity identity = properties.getIdentity();

        String username = webRequest.getHeader(identity.getUserHeader());
        if (username == null || username.isBlank()) {
            return null;
        }
        if (!fromTrustedProxy(webRequest, identity)) {
            return null;
        }

        LedgerPrincipal principal = LedgerPrincipal.of(username.trim(),
            parseGroups(webRequest.getHeader(identity.getGroupsHeader())));
        MDC.put(CorrelationContext.PRINCIPAL_MDC_KEY, principal.getUsername());
        return principal;
    }

    private boolean fromTrustedProxy(NativeWebRequest webRequest, LedgerProperties.Identity identity) {
        if (identity.getTrustedProxies().isEmpty()) {
            return true;
        }
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String remoteAddr = request != null ? request.getRemoteAddr() : null;
        if (remoteAddr != null && identity.getTrustedProxies().contains(remoteAddr)) {
            return true;
        }
        log.warn("Ignoring identity headers from untrusted peer {}", remoteAddr);
        return false;
    }

    static Set<String> parseGroups(String header) {
        if (header == null || header.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
            .map(String::trim)
            .filter(group -> !group.isEmpty())
            .collect(Collectors.toSet());
    }
}
