package me.golemcore.consult.domain.exception;

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

import me.golemcore.consult.domain.model.ErrorCategory;
import me.golemcore.consult.domain.model.TransportFailure;
import me.golemcore.consult.domain.model.TransportFailureReason;

/**
 * Connection-level failure between this process and a backend.
 */
public class TransportException extends ConsultException {

    private static final long serialVersionUID = 1L;

    private final transient TransportFailure failure;

    public TransportException(TransportFailureReason reason, String message) {
        this(reason, message, null);
    }

    public TransportException(TransportFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.failure = new TransportFailure(reason, message);
    }

    public TransportFailure getFailure() {
        return failure;
    }

    public TransportFailureReason getReason() {
        return failure.reason();
    }

    public boolean isRetryable() {
        return failure.isRetryable();
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TRANSPORT;
    }
}
