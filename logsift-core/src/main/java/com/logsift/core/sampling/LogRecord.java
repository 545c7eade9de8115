package com.logsift.core.sampling;

/** Anything with a message the {@link Sampler} can normalize. */
public interface LogRecord {

    String message();
}
