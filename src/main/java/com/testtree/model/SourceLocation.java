package com.testtree.model;

/**
 * A file name and line number recovered from diagnostic text.
 */
public record SourceLocation(String file, int line) {

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
