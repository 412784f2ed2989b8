package me.golemcore.consult.domain.model;

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

import me.golemcore.consult.domain.exception.ConsultException;
import me.golemcore.consult.domain.exception.ResponseFailureException;
import me.golemcore.consult.domain.exception.TransportException;

/**
 * What gets recorded about a failed run.
 */
public record FailureDetails(String message, ErrorCategory category, TransportFailureReason transportReason,
        ResponseMetadata response) {

    public static FailureDetails of(Throwable error) {
        String message = error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : error.getClass().getSimpleName();
        ErrorCategory category = error instanceof ConsultException consultException
                ? consultException.getCategory()
                : ErrorCategory.INTERNAL;
        TransportFailureReason transportReason = error instanceof TransportException transportException
                ? transportException.getReason()
                : null;
        ResponseMetadata response = error instanceof ResponseFailureException responseFailure
                ? responseFailure.getMetadata()
                : null;
        return new FailureDetails(message, category, transportReason, response);
    }
}
