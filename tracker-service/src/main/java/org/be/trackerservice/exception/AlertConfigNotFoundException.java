package org.be.trackerservice.exception;

public class AlertConfigNotFoundException extends RuntimeException {

    public AlertConfigNotFoundException(Long id) {
        super("Alert config not found: " + id);
    }
}
