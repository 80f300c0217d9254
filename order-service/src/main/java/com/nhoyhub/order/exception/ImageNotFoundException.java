package com.nhoyhub.order.exception;

public class ImageNotFoundException extends RuntimeException {

    public ImageNotFoundException(String filename) {
        super("Image not found: " + filename);
    }
}
