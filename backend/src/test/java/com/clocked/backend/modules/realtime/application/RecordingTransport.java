package com.clocked.backend.modules.realtime.application;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.clocked.backend.modules.realtime.domain.ConnectionTransport;

class RecordingTransport implements ConnectionTransport {

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile Integer closeCode;
    private volatile String closeReason;

    RecordingTransport(String id) {
        this.id = id;
    }

    RecordingTransport failingSends() {
        this.failSends = true;
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) throws IOException {
        if (failSends) {
            throw new IOException("broken pipe");
        }
        frames.add(text);
    }

    @Override
    public void close(int code, String reason) {
        if (!open) {
            return;
        }
        open = false;
        closeCode = code;
        closeReason = reason;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    List<String> frames() {
        return frames;
    }

    Integer closeCode() {
        return closeCode;
    }

    String closeReason() {
        return closeReason;
    }
}
