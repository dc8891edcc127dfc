package com.shophub.global.exception;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * unique 제약 위반 예외에서 제약 이름을 찾아 사용자 메시지로 변환한다.
 *
 * 애플리케이션 레벨 중복 검사를 통과한 뒤 동시 요청이 먼저 커밋한 경우
 * 저장소의 unique 인덱스가 최종 방어선이 되며, 이때 발생한 예외를 여기서 해석한다.
 */
@Component
public class DuplicateConstraintMessageResolver {

    private static final String DEFAULT_MESSAGE = "중복된 데이터가 존재합니다. 다시 시도해주세요.";

    private static final Map<String, String> KEYWORD_TO_MESSAGE = new LinkedHashMap<>();

    static {
        KEYWORD_TO_MESSAGE.put("uk_reviews_user_product", "이미 이 상품에 리뷰를 작성하였습니다.");
        KEYWORD_TO_MESSAGE.put("uk_review_helpfuls_review_user", "이미 도움이 돼요를 누른 리뷰입니다.");
        KEYWORD_TO_MESSAGE.put("username", "이미 사용 중인 아이디입니다.");
    }

    public String resolve(DataIntegrityViolationException exception) {
        if (exception == null) {
            return DEFAULT_MESSAGE;
        }

        String raw = buildSearchableMessage(exception).toLowerCase(Locale.ROOT);

        for (Map.Entry<String, String> entry : KEYWORD_TO_MESSAGE.entrySet()) {
            if (raw.contains(entry.getKey())) {
                return entry.getValue();
            }
        }

        return DEFAULT_MESSAGE;
    }

    public boolean isDuplicateReview(DataIntegrityViolationException exception) {
        return exception != null
                && buildSearchableMessage(exception).toLowerCase(Locale.ROOT).contains("uk_reviews_user_product");
    }

    private String buildSearchableMessage(Throwable throwable) {
        StringBuilder builder = new StringBuilder();
        Throwable cursor = throwable;

        while (cursor != null) {
            if (cursor.getMessage() != null) {
                builder.append(cursor.getMessage()).append(' ');
            }
            cursor = cursor.getCause();
        }

        return builder.toString();
    }
}
