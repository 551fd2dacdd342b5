package com.ivamare.eventdispatch.model;

/**
 * Plain success signal. A handler returning it always succeeds once it returns.
 */
public enum Acknowledgement {
    ACK
}
