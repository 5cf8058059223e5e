package com.github.trinity.samplingimager;

/**
 * Base class of every failure raised by the imaging pipeline.
 *
 * @author Sean Phillips
 */
public class ImagingException extends RuntimeException {

    public ImagingException(String message) {
        super(message);
    }

    public ImagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
