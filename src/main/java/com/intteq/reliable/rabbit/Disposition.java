package com.intteq.reliable.rabbit;

/**
 * Terminal outcome of a single delivery.
 */
public enum Disposition {
    /** basic.ack, the message is removed. */
    ACK,
    /** basic.nack with requeue, the broker redelivers. */
    NACK,
    /** basic.reject without requeue, the message is dropped or dead-lettered. */
    REJECT,
    /** basic.reject with requeue, the message goes back on the original queue. */
    REJECT_REQUEUE
}
