package com.autobudget.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    REMOTE_API_ERROR("REMOTE_API_ERROR"),
    DIRECTORY_ERROR("DIRECTORY_ERROR");

    private final String code;
}
