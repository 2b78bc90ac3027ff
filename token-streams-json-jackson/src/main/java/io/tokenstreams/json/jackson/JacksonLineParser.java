package io.tokenstreams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tokenstreams.core.Event;
import io.tokenstreams.core.LineParser;
import io.tokenstreams.core.TokenStreamsException;

import java.util.Objects;

/**
 * Jackson implementation of {@link LineParser} for newline-delimited JSON.
 *
 * <p>Each line is read as one JSON document. The completion flag is read from {@link #donePointer()}
 * (default {@code /done}; absent means {@code false}). The payload is the whole document, or the
 * node at {@link #payloadPointer()} when one is set, mapped to the payload type.
 *
 * <pre>{@code
 * // {"model":"llama3","response":"Hel","done":false}
 * LineParser<String> parser = JacksonLineParser.of(String.class).withPayloadAt("/response");
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between streams.
 */
public final class JacksonLineParser<T> implements LineParser<T> {

    public static final String DEFAULT_DONE_POINTER = "/done";

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper(new JsonFactory());

    private final ObjectMapper mapper;
    private final JavaType type;
    private final JsonPointer donePointer;
    private final JsonPointer payloadPointer;

    private JacksonLineParser(ObjectMapper mapper, JavaType type, JsonPointer donePointer, JsonPointer payloadPointer) {
        this.mapper = mapper;
        this.type = type;
        this.donePointer = donePointer;
        this.payloadPointer = payloadPointer;
    }

    /**
     * Creates a parser mapping each document to {@code type} with a default ObjectMapper.
     */
    public static <T> JacksonLineParser<T> of(Class<T> type) {
        return of(DEFAULT_MAPPER, type);
    }

    /**
     * Creates a parser mapping each document to {@code type} with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public static <T> JacksonLineParser<T> of(ObjectMapper mapper, Class<T> type) {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(type, "type");
        return new JacksonLineParser<>(mapper, mapper.constructType(type),
                JsonPointer.compile(DEFAULT_DONE_POINTER), null);
    }

    /**
     * Creates a parser that keeps documents as Jackson trees.
     */
    public static JacksonLineParser<JsonNode> tree() {
        return of(DEFAULT_MAPPER, JsonNode.class);
    }

    /**
     * @param pointer JSON pointer of the boolean completion flag, e.g. {@code /done}
     */
    public JacksonLineParser<T> withDonePointer(String pointer) {
        return new JacksonLineParser<>(mapper, type, compile(pointer), payloadPointer);
    }

    /**
     * @param pointer JSON pointer of the payload node, e.g. {@code /message/content}
     */
    public JacksonLineParser<T> withPayloadAt(String pointer) {
        return new JacksonLineParser<>(mapper, type, donePointer, compile(pointer));
    }

    public JsonPointer donePointer() {
        return donePointer;
    }

    /** @return the payload pointer, or {@code null} if the whole document is the payload */
    public JsonPointer payloadPointer() {
        return payloadPointer;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public Event<T> parse(String line) {
        JsonNode document;
        try {
            document = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new TokenStreamsException.Decode("Failed to parse line as JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.isMissingNode()) {
            throw new TokenStreamsException.Decode("Failed to parse line as JSON: no content");
        }

        boolean done = document.at(donePointer).asBoolean(false);

        JsonNode payloadNode = payloadPointer == null ? document : document.at(payloadPointer);
        if (payloadNode.isMissingNode() || payloadNode.isNull()) {
            throw new TokenStreamsException.Decode("No payload at " + payloadPointer);
        }

        T payload;
        try {
            payload = mapper.treeToValue(payloadNode, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TokenStreamsException.Decode("Failed to map payload to " + type.toCanonical(), e);
        }
        if (payload == null) {
            throw new TokenStreamsException.Decode("Payload mapped to null for " + type.toCanonical());
        }
        return new Event<>(payload, done);
    }

    private static JsonPointer compile(String pointer) {
        Objects.requireNonNull(pointer, "pointer");
        try {
            return JsonPointer.compile(pointer);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid JSON pointer: " + pointer, e);
        }
    }

    @Override
    public String toString() {
        return "JacksonLineParser{type=" + type.toCanonical() + ", done=" + donePointer
                + ", payload=" + (payloadPointer == null ? "<document>" : payloadPointer) + '}';
    }
}
