package com.nightshade.sequence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nightshade.sequence.model.Sequence;
import com.nightshade.sequence.model.SequenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization of sequences and single nodes. Nulls are omitted on write; unknown properties are
 * ignored on read so documents written by newer releases still load. Timestamps are ISO-8601.
 */
public final class SequenceJson {

    private static final Logger log = LoggerFactory.getLogger(SequenceJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE);

    private SequenceJson() {
    }

    /**
     * Parses a sequence document.
     *
     * @throws UncheckedIOException on malformed JSON
     */
    public static Sequence fromJson(String json) {
        Sequence sequence;
        try {
            sequence = MAPPER.readValue(json, Sequence.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (sequence.getSchemaVersion() > Sequence.CURRENT_SCHEMA_VERSION) {
            log.warn("Sequence written by a newer format | sequenceId={} | schemaVersion={} | supported={}",
                    sequence.getId(), sequence.getSchemaVersion(), Sequence.CURRENT_SCHEMA_VERSION);
        }
        return sequence;
    }

    public static String toJson(Sequence sequence) {
        try {
            return MAPPER.writeValueAsString(sequence);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(Sequence sequence) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(sequence);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Parses one node, e.g. from a clipboard or template snippet. */
    public static SequenceNode nodeFromJson(String json) {
        try {
            return MAPPER.readValue(json, SequenceNode.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(SequenceNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
