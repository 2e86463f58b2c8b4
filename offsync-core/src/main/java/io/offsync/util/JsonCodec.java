package io.offsync.util;

/**
 * Codec used for queued payloads and persisted snapshots.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) writes instants as ISO-8601
 * strings and ignores unknown properties, so snapshots written by an older version stay
 * readable. Supply a different codec to share an application-wide {@code ObjectMapper}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON.
     *
     * @param value the value, may be {@code null}
     * @return JSON text
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    String toJson(Object value);

    /**
     * Decodes JSON text into an instance of {@code type}.
     *
     * @param json the JSON text
     * @param type target type
     * @param <T> target type
     * @return decoded value, {@code null} for a JSON {@code null}
     * @throws IllegalArgumentException if the text is not valid JSON for {@code type}
     */
    <T> T fromJson(String json, Class<T> type);

    /**
     * Converts an already-decoded tree (maps, lists, scalars) into an instance of {@code type}.
     *
     * @param value the decoded tree
     * @param type target type
     * @param <T> target type
     * @return converted value
     * @throws IllegalArgumentException if the tree does not fit {@code type}
     */
    <T> T convert(Object value, Class<T> type);
}
