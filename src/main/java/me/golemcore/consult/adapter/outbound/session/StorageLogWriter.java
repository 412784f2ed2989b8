package me.golemcore.consult.adapter.outbound.session;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.port.outbound.ModelLogWriter;
import me.golemcore.consult.port.outbound.StoragePort;

/**
 * Append-only log file backed by {@link StoragePort}. Writes after
 * {@link #close()} are dropped.
 */
@Slf4j
class StorageLogWriter implements ModelLogWriter {

    private final StoragePort storagePort;
    private final String directory;
    private final String path;
    private boolean closed;

    StorageLogWriter(StoragePort storagePort, String directory, String path) {
        this.storagePort = storagePort;
        this.directory = directory;
        this.path = path;
        storagePort.appendText(directory, path, "").join();
    }

    @Override
    public synchronized boolean writeChunk(String text) {
        if (closed || text == null || text.isEmpty()) {
            return !closed;
        }
        storagePort.appendText(directory, path, text).join();
        return true;
    }

    @Override
    public synchronized void writeLine(String line) {
        if (closed) {
            log.debug("[SessionStore] Dropping line written after close: {}", path);
            return;
        }
        storagePort.appendText(directory, path, (line != null ? line : "") + "\n").join();
    }

    @Override
    public String location() {
        return directory + "/" + path;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }
}
