package com.chainindexer.query;

public class InvalidPageException extends RuntimeException {

    public InvalidPageException(int page) {
        super("Page index must be >= 0, got " + page);
    }
}
