package com.tessera.knowledgeservice.infrastructure.web;

/** The caller is known but may not touch the resource. Mapped to 403. */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
