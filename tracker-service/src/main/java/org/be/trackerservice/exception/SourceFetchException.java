package org.be.trackerservice.exception;

import lombok.Getter;
import org.be.trackerservice.enums.SkipReason;

/**
 * 어댑터 내부에서만 쓰이며 {@link org.be.trackerservice.dto.SourceFetchResult} 로 변환된다.
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final SkipReason reason;

    public SourceFetchException(SkipReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SourceFetchException(SkipReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
