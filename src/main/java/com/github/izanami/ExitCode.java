package com.github.izanami;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@RequiredArgsConstructor
public enum ExitCode {
    OK(0),
    HOST_ERROR(1),
    USAGE(64),
    LEXICAL_ERROR(65),
    RUNTIME_ERROR(70),
    PARSE_ERROR(75);

    @Getter
    @Accessors(fluent = true)
    private final int code;
}
