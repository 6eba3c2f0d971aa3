package io.vocalis.core.memory.client;

/** A category entry whose summary cannot be read as text. */
public final class CategoryFormatException extends Exception {

    public CategoryFormatException(String message) {
        super(message);
    }
}
