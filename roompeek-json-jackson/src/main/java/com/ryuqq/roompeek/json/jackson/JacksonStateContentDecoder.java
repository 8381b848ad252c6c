package com.ryuqq.roompeek.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.roompeek.core.spi.StateContentDecodeException;
import com.ryuqq.roompeek.core.spi.StateContentDecoder;
import com.ryuqq.roompeek.core.visibility.HistoryVisibility;
import com.ryuqq.roompeek.core.visibility.HistoryVisibilityContent;

import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of {@link StateContentDecoder}.
 *
 * <p>Content is read as a {@code Map<String, String>}. Number and boolean to string
 * coercion is turned off, so a number, boolean, nested object or array anywhere in the
 * content fails decoding instead of being silently converted. A JSON {@code null} value,
 * or content that is the JSON literal {@code null}, counts as an absent key.</p>
 */
public final class JacksonStateContentDecoder implements StateContentDecoder {

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    /**
     * Creates a decoder with a strict default mapper.
     */
    public JacksonStateContentDecoder() {
        this(JsonMapper.builder()
            .withCoercionConfig(LogicalType.Textual, config -> config
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
            .build());
    }

    /**
     * Creates a decoder with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonStateContentDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public HistoryVisibilityContent decodeHistoryVisibility(String content) {
        if (content == null) {
            throw new StateContentDecodeException("content is null");
        }
        Map<String, String> fields;
        try {
            fields = mapper.readValue(content, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new StateContentDecodeException("content is not a string map: " + e.getOriginalMessage(), e);
        }
        if (fields == null) {
            return HistoryVisibilityContent.missingKey();
        }
        return new HistoryVisibilityContent(fields.get(HistoryVisibility.CONTENT_KEY));
    }
}
