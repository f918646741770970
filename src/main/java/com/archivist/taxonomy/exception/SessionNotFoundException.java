package com.archivist.taxonomy.exception;

import java.util.UUID;

public class SessionNotFoundException extends EntityNotFoundException {

    public SessionNotFoundException(UUID sessionId) {
        super("Session", sessionId);
    }
}
