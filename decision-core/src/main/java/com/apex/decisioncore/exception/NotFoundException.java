package com.apex.decisioncore.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends RuntimeException {

    private final String resource;

    public NotFoundException(String resource, String key) {
        super("No " + resource.replace('_', ' ') + " named " + key);
        this.resource = resource;
    }
}
