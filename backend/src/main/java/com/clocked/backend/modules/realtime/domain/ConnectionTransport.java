package com.clocked.backend.modules.realtime.domain;

import java.io.IOException;

/**
 * Outbound side of one client socket. Implementations serialize concurrent sends.
 */
public interface ConnectionTransport {

    String id();

    void send(String text) throws IOException;

    /**
     * Closes the socket; failures are logged by the implementation and never thrown.
     */
    void close(int code, String reason);

    boolean isOpen();
}
