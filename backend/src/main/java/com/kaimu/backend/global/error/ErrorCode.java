package com.kaimu.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A typed failure kind surfaced to callers. Each component declares its own enum.
 */
public interface ErrorCode {

    HttpStatus status();

    String code();

    String defaultDetail();
}
