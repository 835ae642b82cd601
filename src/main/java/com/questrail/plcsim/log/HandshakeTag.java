package com.questrail.plcsim.log;

/**
 * Operator annotation marking a telegram as one half of a request/acknowledge pair.
 */
public enum HandshakeTag
{
    NONE,
    REQ,
    ACK
}
