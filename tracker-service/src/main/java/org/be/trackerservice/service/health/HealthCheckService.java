package org.be.trackerservice.service.health;

import java.util.Map;

public interface HealthCheckService {

    /**
     * 전체 시스템의 상세 헬스체크
     */
    Map<String, Object> getDetailedHealth();

    /**
     * 데이터베이스 연결 상태 확인
     */
    void checkDatabaseConnection();

    /**
     * 소스별 인증 정보 설정 여부
     */
    Map<String, Boolean> getSourceConfiguration();
}
