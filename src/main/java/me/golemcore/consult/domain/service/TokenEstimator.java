package me.golemcore.consult.domain.service;

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

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import me.golemcore.consult.domain.model.BackendRequest;
import org.springframework.stereotype.Component;

/**
 * Local input-token estimate for a request body, used for the input budget
 * check and as a fallback when the backend reports no input count.
 */
@Component
public class TokenEstimator {

    private static final EncodingRegistry REGISTRY = Encodings.newLazyEncodingRegistry();
    private static final Encoding ENCODING = REGISTRY.getEncoding(EncodingType.O200K_BASE);

    public int estimate(BackendRequest request) {
        int tokens = count(request.getInstructions()) + count(request.userText());
        if (request.getTools() != null) {
            for (BackendRequest.Tool tool : request.getTools()) {
                tokens += count(tool.getType());
            }
        }
        return tokens;
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return ENCODING.countTokens(text);
    }
}
