package org.be.trackerservice.client.source;

import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.MentionSource;

/**
 * 외부 소스 하나에 대한 검색 + 정규화.
 * 구현체는 예외를 던지지 않고 실패를 건너뜀 결과로 돌려준다.
 */
public interface SourceAdapter {

    MentionSource getSource();

    SourceFetchResult fetch(String query);
}
