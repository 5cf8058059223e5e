package com.github.trinity.samplingimager;

/**
 * Raised when an imaging run is cancelled from outside (the calling thread was
 * interrupted). In-flight workers are abandoned.
 *
 * @author Sean Phillips
 */
public class ImagingCancelledException extends ImagingException {

    public ImagingCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
