package com.intteq.reliable.rabbit;

import com.intteq.reliable.rabbit.exception.PublishMessageException;

/**
 * Side channel that captures messages needing offline inspection.
 */
@FunctionalInterface
public interface QuarantineSink {

    /**
     * @throws PublishMessageException if the body could not be stored
     */
    void publish(byte[] body);
}
