package me.golemcore.consult.port.outbound;

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

/**
 * Caller-visible output of a run: streamed answer text plus status lines.
 */
public interface RunOutput {

    /**
     * Write a raw chunk of answer text.
     *
     * @return {@code false} when the sink asks the writer to back off; callers
     *         may ignore it
     */
    boolean writeChunk(String text);

    /**
     * Write a full status line.
     */
    void writeLine(String line);

    static RunOutput discarding() {
        return new RunOutput() {
            @Override
            public boolean writeChunk(String text) {
                return true;
            }

            @Override
            public void writeLine(String line) {
                // no-op
            }
        };
    }
}
