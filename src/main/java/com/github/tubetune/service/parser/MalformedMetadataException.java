package com.github.tubetune.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Well-formed JSON that does not have the expected shape.
 */
public class MalformedMetadataException extends JsonProcessingException {

    public MalformedMetadataException(String message) {
        super(message);
    }
}
