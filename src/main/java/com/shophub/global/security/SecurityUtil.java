package com.shophub.global.security;

import com.shophub.global.exception.BusinessException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class SecurityUtil {

    private SecurityUtil() {}

    public static Optional<Long> getCurrentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof CustomUserPrincipal principal) {
            return Optional.of(principal.getUserId());
        }
        return Optional.empty();
    }

    /**
     * 인증이 필요한 경로에서 사용한다. 보안 필터를 통과했다면 항상 존재해야 한다.
     */
    public static Long requireCurrentUserId() {
        return getCurrentUserId()
                .orElseThrow(() -> new BusinessException("UNAUTHORIZED", "인증이 필요합니다."));
    }
}
