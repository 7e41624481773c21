package com.tessera.knowledgeservice.infrastructure.web;

/** The caller is not identified, or its credential was refused. Mapped to 401. */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
