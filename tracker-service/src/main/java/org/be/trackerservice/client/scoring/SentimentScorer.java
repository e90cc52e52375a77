package org.be.trackerservice.client.scoring;

import org.be.trackerservice.dto.SentimentScore;

public interface SentimentScorer {

    /**
     * @param text 512자 이내로 잘린 본문
     * @return 라벨과 [0, 1] 범위 신뢰도
     * @throws org.be.trackerservice.exception.ScoringException 서비스 미설정, 호출 실패, 해석 불가 응답
     */
    SentimentScore score(String text);
}
