package com.ryuqq.orchestration.core.model;

import java.util.regex.Pattern;

/**
 * Upstream Provider 식별자.
 *
 * <p>설정 파일에서 로드되는 Provider의 키이며, Rate Limiter 버킷 키와
 * Health Monitor 레코드 키로 함께 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ProviderId.of("openai-primary")</li>
 *   <li>ProviderId.of("anthropic-fallback")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 소문자, 숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ProviderId implements Comparable<ProviderId> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9\\-_]+$");

    private final String value;

    private ProviderId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProviderId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("ProviderId length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ProviderId must contain only lowercase letters, digits, hyphens and underscores (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ProviderId 생성.
     *
     * @param value ProviderId 값
     * @return ProviderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ProviderId of(String value) {
        return new ProviderId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ProviderId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderId that = (ProviderId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
