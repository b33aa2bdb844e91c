package com.github.izanami.parser;

import java.util.List;

import com.github.izanami.parser.CompilationUnit.Statement;

public sealed interface ParseResult {

    record Success(Statement statement) implements ParseResult {}

    record Failure(List<ParseError> errors) implements ParseResult {
        public Failure {
            errors = List.copyOf(errors);
        }
    }

}
