package me.golemcore.consult.domain.service;

import me.golemcore.consult.port.outbound.RunOutput;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingOutput implements RunOutput {

    private final List<String> chunks = new CopyOnWriteArrayList<>();
    private final List<String> lines = new CopyOnWriteArrayList<>();

    @Override
    public boolean writeChunk(String text) {
        chunks.add(text);
        return true;
    }

    @Override
    public void writeLine(String line) {
        lines.add(line);
    }

    String chunkText() {
        return String.join("", chunks);
    }

    List<String> lines() {
        return lines;
    }

    boolean hasLineContaining(String fragment) {
        return lines.stream().anyMatch(line -> line.contains(fragment));
    }
}
