package com.busreview.tracker.scrape.service;

public class CheckpointConflictException extends RuntimeException {
    public CheckpointConflictException(String message) {
        super(message);
    }
}
