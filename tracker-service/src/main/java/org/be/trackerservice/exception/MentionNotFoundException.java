package org.be.trackerservice.exception;

public class MentionNotFoundException extends RuntimeException {

    public MentionNotFoundException(Long id) {
        super("Mention not found: " + id);
    }
}
