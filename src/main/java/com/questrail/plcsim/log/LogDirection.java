package com.questrail.plcsim.log;

/** Origin of a log entry. */
public enum LogDirection
{
    /** Received from the host. */
    RX,
    /** Sent to the host. */
    TX,
    /** Local notice (status change, error, operator action). */
    SYS
}
