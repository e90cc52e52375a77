package org.be.trackerservice.dto;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.be.trackerservice.enums.MentionSource;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 소스 어댑터가 정규화한 수집 후보. 내용이 비어 있으면 생성할 수 없다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class MentionCandidate {

    private final MentionSource source;
    private final String url;
    private final String author;
    private final String content;

    /**
     * 원본 게시 시각 (UTC), 없거나 파싱 실패 시 null
     */
    private final LocalDateTime publishedAt;

    @Builder
    private MentionCandidate(MentionSource source, String url, String author, String content,
                             LocalDateTime publishedAt) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        this.url = url != null ? url : "";
        this.author = author != null ? author : "";
        this.content = content.trim();
        this.publishedAt = publishedAt;
    }
}
