package com.shophub.global.security;

import com.shophub.domain.user.entity.User;
import com.shophub.domain.user.repository.UserRepository;
import com.shophub.global.config.CacheConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.Locale;

@Service
public class CustomUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;

    public CustomUserDetailsService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * 사용자 인증 정보 조회.
     * HTTP Basic은 요청마다 인증하므로 동일 username 조회를 1분간 캐시한다.
     * BCrypt 검증은 캐시와 무관하게 매번 실행된다.
     */
    @Override
    @Cacheable(value = CacheConfig.USER_DETAILS_CACHE, key = "(#username == null ? '' : #username.trim().toLowerCase())")
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        String normalizedUsername = normalizeUsername(username);
        User user = userRepository.findByUsernameIgnoreCase(normalizedUsername)
                .orElseThrow(() -> new UsernameNotFoundException("사용자를 찾을 수 없습니다: " + username));

        if (!user.getIsActive()) {
            throw new UsernameNotFoundException("비활성화된 계정입니다.");
        }

        return new CustomUserPrincipal(
                user.getUserId(),
                user.getUsername(),
                user.getPasswordHash(),
                user.getRole(),
                Collections.singletonList(new SimpleGrantedAuthority(user.getRole()))
        );
    }

    private String normalizeUsername(String username) {
        return username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
    }
}
