package org.be.trackerservice.enums;

/**
 * 소스 수집이 결과 없이 끝난 이유
 */
public enum SkipReason {
    MISSING_CREDENTIALS("인증 정보 미설정"),
    AUTH_FAILED("토큰 발급 실패"),
    REQUEST_FAILED("검색 요청 실패"),
    MALFORMED_PAYLOAD("응답 파싱 실패"),
    UNEXPECTED_ERROR("예상치 못한 오류");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 설정 누락은 실패가 아니다
     */
    public boolean isFailure() {
        return this != MISSING_CREDENTIALS;
    }
}
