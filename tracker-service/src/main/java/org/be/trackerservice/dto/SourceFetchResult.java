package org.be.trackerservice.dto;

import lombok.Getter;
import lombok.ToString;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SkipReason;

import java.util.List;
import java.util.Optional;

/**
 * 단일 소스 수집 결과. 성공(목록, 비어 있을 수 있음) 또는 건너뜀(사유 포함) 중 하나.
 */
@Getter
@ToString
public class SourceFetchResult {

    private final MentionSource source;
    private final List<MentionCandidate> candidates;
    private final SkipReason skipReason;
    private final String detail;

    private SourceFetchResult(MentionSource source, List<MentionCandidate> candidates,
                              SkipReason skipReason, String detail) {
        this.source = source;
        this.candidates = List.copyOf(candidates);
        this.skipReason = skipReason;
        this.detail = detail;
    }

    public static SourceFetchResult success(MentionSource source, List<MentionCandidate> candidates) {
        return new SourceFetchResult(source, candidates, null, null);
    }

    public static SourceFetchResult skipped(MentionSource source, SkipReason reason, String detail) {
        return new SourceFetchResult(source, List.of(), reason, detail);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public Optional<SkipReason> skipReason() {
        return Optional.ofNullable(skipReason);
    }
}
