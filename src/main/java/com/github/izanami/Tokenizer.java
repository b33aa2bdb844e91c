package com.github.izanami;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.izanami.runtime.NumberValue;
import com.github.izanami.runtime.StringValue;
import com.github.izanami.runtime.Value;

import lombok.Getter;
import lombok.experimental.Accessors;

public class Tokenizer {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (var tokenType : TokenType.values()) {
            if (tokenType.keyword) {
                KEYWORDS.put(tokenType.constantPattern, tokenType);
            }
        }
    }

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.keyword) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());
        patterns.add(new CommentPattern());

        // comments before "/", longer operators before their one-character prefixes
        patterns.sort(Comparator.comparingInt(Pattern::priority).reversed());
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();
        List<LexError> errors = new ArrayList<>();

        int index = 0;
        int line = 1;
        while (index < programString.length()) {
            char c = programString.charAt(index);
            if (c == '\n') {
                line++;
                index++;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r') {
                index++;
                continue;
            }

            boolean gotMatch = false;
            try {
                for (var pattern : patterns) {
                    var result = pattern.match(programString, index, line);
                    if (result.isPresent()) {
                        var token = result.get();
                        if (token.type() != TokenType.COMMENT) {
                            tokens.add(token);
                        }
                        line += countNewlines(programString, token.start(), token.end());
                        index = token.end();
                        gotMatch = true;
                        break;
                    }
                }
            } catch (LexException e) {
                errors.add(new LexError(e.getMessage(), e.line));
                line += countNewlines(programString, index, e.resumeAt);
                index = e.resumeAt;
                continue;
            }
            if (!gotMatch) {
                errors.add(new LexError("Unexpected character.", line));
                index += Character.charCount(programString.codePointAt(index));
            }
        }

        tokens.add(new Token(TokenType.EOF, "", Optional.empty(), line, index, index));

        return new Tokens(tokens, errors);
    }

    private static int countNewlines(String programString, int start, int end) {
        int count = 0;
        for (int i = start; i < end; i++) {
            if (programString.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    interface Pattern {
        Optional<Token> match(String programString, int index, int line);

        default int priority() {
            return Integer.MIN_VALUE;
        }
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, Optional.empty(), line, index, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return pattern.length();
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (isDigit(programString, index)) {
                int start = index;
                while (isDigit(programString, index)) {
                    index++;
                }
                // a trailing dot stays a separate token unless a digit follows it
                if (index < programString.length() && programString.charAt(index) == '.' && isDigit(programString, index + 1)) {
                    index++;
                    while (isDigit(programString, index)) {
                        index++;
                    }
                }
                var image = programString.substring(start, index);
                Value literal = new NumberValue(Double.parseDouble(image));
                return Optional.of(new Token(TokenType.NUMBER, image, Optional.of(literal), line, start, index));
            } else {
                return Optional.empty();
            }
        }

        private static boolean isDigit(String programString, int index) {
            if (index >= programString.length()) {
                return false;
            }
            char c = programString.charAt(index);
            return c >= '0' && c <= '9';
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (isAlpha(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isAlphaNumeric(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = KEYWORDS.getOrDefault(image, TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, Optional.empty(), line, start, index));
            } else {
                return Optional.empty();
            }
        }

        private static boolean isAlpha(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isAlphaNumeric(char c) {
            return isAlpha(c) || (c >= '0' && c <= '9');
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.charAt(index) == '"') {
                int start = index;
                index++;
                while (index < programString.length() && programString.charAt(index) != '"') {
                    index++;
                }
                if (index == programString.length()) {
                    throw new LexException("Unterminated string.", line, index);
                }
                index += 1;
                var image = programString.substring(start, index);
                Value literal = new StringValue(programString.substring(start + 1, index - 1));
                return Optional.of(new Token(TokenType.STRING, image, Optional.of(literal), line, start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.startsWith("//", index)) {
                int start = index;
                index += 2;
                while (index < programString.length() && programString.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, index), Optional.empty(), line, start, index));
            } else if (programString.startsWith("/*", index)) {
                int start = index;
                int close = programString.indexOf("*/", index + 2);
                index = close < 0 ? programString.length() : close + 2;
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, index), Optional.empty(), line, start, index));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return Integer.MAX_VALUE;
        }
    }

    private static class LexException extends RuntimeException {
        final int line;
        final int resumeAt;

        LexException(String message, int line, int resumeAt) {
            super(message, null, false, false);
            this.line = line;
            this.resumeAt = resumeAt;
        }
    }

    public record Token(TokenType type, String lexeme, Optional<Value> literal, int line, int start, int end) {
        public int length() {
            return end - start;
        }

        @Override
        public String toString() {
            return type + " " + lexeme + literal.map(l -> " " + l).orElse("");
        }
    }

    public record LexError(String message, int line) {}

    public enum TokenType {
        LPAREN("("), RPAREN(")"),
        LBRACE("{"), RBRACE("}"),
        COMMA(","), DOT("."), SEMICOLON(";"),
        MINUS("-"), PLUS("+"),
        SLASH("/"), STAR("*"),
        QUESTION("?"), COLON(":"),

        BANG("!"), NOT_EQUALS("!="),
        EQUALS("="), EQUALS_EQUALS("=="),
        GT(">"), GE(">="),
        LT("<"), LE("<="),

        IDENTIFIER,
        STRING,
        NUMBER,

        AND("and", true),
        CLASS("class", true),
        ELSE("else", true),
        FALSE("false", true),
        FOR("for", true),
        FUN("fun", true),
        IF("if", true),
        NIL("nil", true),
        OR("or", true),
        PRINT("print", true),
        RETURN("return", true),
        SUPER("super", true),
        THIS("this", true),
        TRUE("true", true),
        VAR("var", true),
        WHILE("while", true),
        BREAK("break", true),

        COMMENT,
        EOF;

        final String constantPattern;
        final boolean keyword;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this(constantPattern, false);
        }
        private TokenType(String constantPattern, boolean keyword) {
            this.constantPattern = constantPattern;
            this.keyword = keyword;
        }
    }

    // the cursor never moves past EOF
    public static class Tokens {
        @Getter
        @Accessors(fluent = true)
        private final List<Token> tokens;
        @Getter
        @Accessors(fluent = true)
        private final List<LexError> errors;
        private int index;

        public Tokens(List<Token> tokens, List<LexError> errors) {
            this.tokens = List.copyOf(tokens);
            this.errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public Token peek() {
            return tokens.get(index);
        }

        public Token previous() {
            return tokens.get(index - 1);
        }

        public boolean isAtEnd() {
            return peek().type() == TokenType.EOF;
        }

        public Token next() {
            var token = peek();
            if (!isAtEnd()) {
                index++;
            }
            return token;
        }

        public boolean matches(TokenType... types) {
            if (isAtEnd()) {
                return false;
            }
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        /** Consumes the next token if it is one of {@code types}. */
        public boolean advanceIf(TokenType... types) {
            if (matches(types)) {
                next();
                return true;
            }
            return false;
        }
    }

}
