package me.golemcore.consult.domain.service;

import me.golemcore.consult.port.outbound.ModelLogWriter;

final class InMemoryLogWriter implements ModelLogWriter {

    private final String location;
    private final StringBuilder content = new StringBuilder();
    private boolean closed;

    InMemoryLogWriter(String location) {
        this.location = location;
    }

    @Override
    public synchronized boolean writeChunk(String text) {
        content.append(text);
        return true;
    }

    @Override
    public synchronized void writeLine(String line) {
        content.append(line).append('\n');
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    synchronized String content() {
        return content.toString();
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
