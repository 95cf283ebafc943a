package com.mathclip;

/**
 * A conversion failed and produced no output.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }
}
