package me.golemcore.consult.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.Response;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.domain.exception.ResponseFailureException;
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.domain.model.ResponseMetadata;
import me.golemcore.consult.domain.model.ResponseStreamEvent;
import me.golemcore.consult.infrastructure.http.FeignClientFactory;
import me.golemcore.consult.port.outbound.ResponsesClient;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client for the OpenAI Responses API.
 *
 * <p>
 * Blocking calls ({@code create}, {@code retrieve}) go through a Feign client
 * per base URL. Streaming reads the server-sent event stream directly from
 * OkHttp on a bounded-elastic thread; disposing the subscription cancels the
 * call.
 *
 * <p>
 * Provider ID: {@code "openai"}
 */
@Component
@Slf4j
public class OpenAiResponsesClient implements ResponsesClient {

    static final String PROVIDER_ID = "openai";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String REQUEST_ID_HEADER = "x-request-id";
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, ResponsesApi> apis = new ConcurrentHashMap<>();

    public OpenAiResponsesClient(FeignClientFactory feignClientFactory, OkHttpClient okHttpClient,
            ObjectMapper objectMapper) {
        this.feignClientFactory = feignClientFactory;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean supportsBackground() {
        return true;
    }

    @Override
    public BackendResponse create(BackendRequest request, ResolvedCredential credential) {
        try (Response response = api(credential).createResponse(credential.apiKey(), request)) {
            return decode(response);
        }
    }

    @Override
    public BackendResponse retrieve(String responseId, ResolvedCredential credential) {
        try (Response response = api(credential).retrieveResponse(credential.apiKey(), responseId)) {
            return decode(response);
        }
    }

    @Override
    public Flux<ResponseStreamEvent> stream(BackendRequest request, ResolvedCredential credential) {
        return Flux.<ResponseStreamEvent>create(sink -> {
            Call call = okHttpClient.newCall(buildStreamRequest(request, credential));
            sink.onDispose(call::cancel);
            try (okhttp3.Response response = call.execute()) {
                String requestId = response.header(REQUEST_ID_HEADER);
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    String text = body != null ? body.string() : "";
                    sink.error(httpFailure(response.code(), text, requestId));
                    return;
                }
                if (body == null) {
                    sink.complete();
                    return;
                }
                readEvents(body.source(), requestId, sink);
                sink.complete();
            } catch (IOException | RuntimeException e) {
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Request buildStreamRequest(BackendRequest request, ResolvedCredential credential) {
        BackendRequest streaming = request.toBuilder().stream(true).build();
        String json;
        try {
            json = objectMapper.writeValueAsString(streaming);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request", e);
        }
        return new Request.Builder()
                .url(baseUrl(credential) + "/responses")
                .header("Authorization", "Bearer " + credential.apiKey())
                .header("Accept", "text/event-stream")
                .post(RequestBody.create(json, JSON))
                .build();
    }

    private void readEvents(BufferedSource source, String requestId, FluxSink<ResponseStreamEvent> sink)
            throws IOException {
        StringBuilder data = new StringBuilder();
        String line;
        while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                if (data.length() > 0 && !dispatch(data.toString(), requestId, sink)) {
                    return;
                }
                data.setLength(0);
            } else if (line.startsWith(DATA_PREFIX)) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(DATA_PREFIX.length()).trim());
            }
        }
        if (data.length() > 0 && !sink.isCancelled()) {
            dispatch(data.toString(), requestId, sink);
        }
    }

    /**
     * @return {@code false} when the stream is finished
     */
    private boolean dispatch(String payload, String requestId, FluxSink<ResponseStreamEvent> sink)
            throws JsonProcessingException {
        if (DONE_MARKER.equals(payload)) {
            return false;
        }
        JsonNode event = objectMapper.readTree(payload);
        String type = event.path("type").asText("");
        switch (type) {
        case "response.output_text.delta", "response.output_text.chunk" -> {
            String delta = event.path("delta").asText("");
            if (!delta.isEmpty()) {
                sink.next(ResponseStreamEvent.textDelta(delta));
            }
            return true;
        }
        case "response.completed", "response.incomplete", "response.failed" -> {
            BackendResponse response = objectMapper.treeToValue(event.path("response"), BackendResponse.class);
            if (response != null) {
                response.setRequestId(requestId);
            }
            sink.next(ResponseStreamEvent.completed(response));
            return false;
        }
        case "error" -> {
            String message = event.path("message").asText(event.path("error").path("message").asText("unknown"));
            sink.error(new ResponseFailureException("API stream error: " + message,
                    new ResponseMetadata(null, requestId, null, null)));
            return false;
        }
        default -> {
            sink.next(ResponseStreamEvent.other(type));
            return true;
        }
        }
    }

    private BackendResponse decode(Response response) {
        String requestId = firstHeader(response.headers(), REQUEST_ID_HEADER);
        String body = readBody(response);
        if (response.status() < 200 || response.status() >= 300) {
            throw httpFailure(response.status(), body, requestId);
        }
        try {
            BackendResponse decoded = objectMapper.readValue(body, BackendResponse.class);
            decoded.setRequestId(requestId);
            return decoded;
        } catch (JsonProcessingException e) {
            throw new ResponseFailureException("API returned an unreadable response: " + e.getOriginalMessage(),
                    new ResponseMetadata(null, requestId, null, null));
        }
    }

    private ResponseFailureException httpFailure(int status, String body, String requestId) {
        String detail = body;
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.path("error").hasNonNull("message")) {
                detail = node.path("error").path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[OpenAI] Non-JSON error body: {}", e.getOriginalMessage());
        }
        log.warn("[OpenAI] HTTP {} (request id {}): {}", status, requestId, detail);
        return new ResponseFailureException("API request failed (HTTP " + status + "): " + detail,
                new ResponseMetadata(null, requestId, null, null));
    }

    private static String readBody(Response response) {
        if (response.body() == null) {
            return "";
        }
        try (InputStream in = response.body().asInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String firstHeader(Map<String, Collection<String>> headers, String name) {
        Collection<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.iterator().next();
    }

    private ResponsesApi api(ResolvedCredential credential) {
        return apis.computeIfAbsent(baseUrl(credential),
                url -> feignClientFactory.create(ResponsesApi.class, url));
    }

    private static String baseUrl(ResolvedCredential credential) {
        String url = credential.baseUrl() != null ? credential.baseUrl() : DEFAULT_BASE_URL;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Feign API interface
    public interface ResponsesApi {
        @RequestLine("POST /responses")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        Response createResponse(@Param("apiKey") String apiKey, BackendRequest request);

        @RequestLine("GET /responses/{id}")
        @Headers("Authorization: Bearer {apiKey}")
        Response retrieveResponse(@Param("apiKey") String apiKey, @Param("id") String responseId);
    }
}
