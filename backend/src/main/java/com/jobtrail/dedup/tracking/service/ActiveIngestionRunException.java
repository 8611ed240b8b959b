package com.jobtrail.dedup.tracking.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveIngestionRunException extends RuntimeException {
    public ActiveIngestionRunException(String message) {
        super(message);
    }
}
