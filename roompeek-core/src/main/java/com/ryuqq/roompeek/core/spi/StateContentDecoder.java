package com.ryuqq.roompeek.core.spi;

import com.ryuqq.roompeek.core.visibility.HistoryVisibilityContent;

/**
 * Decodes raw state event content into typed schemas.
 *
 * <p>Content is a JSON object mapping keys to strings. Anything else (malformed JSON,
 * a non-object, a non-string value) is a decode failure and must not be defaulted.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public interface StateContentDecoder {

    /**
     * Decodes the content of an {@code m.room.history_visibility} event.
     *
     * @param content raw JSON content
     * @return the decoded content; {@link HistoryVisibilityContent#missingKey()} if the key is absent
     * @throws StateContentDecodeException if the content is not a key to string mapping
     */
    HistoryVisibilityContent decodeHistoryVisibility(String content);
}
