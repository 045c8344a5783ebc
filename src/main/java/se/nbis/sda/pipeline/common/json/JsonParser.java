package se.nbis.sda.pipeline.common.json;

/**
 * Reads broker message bodies into typed message objects.
 */
public interface JsonParser {

    /**
     * Parses a JSON document into an object of the given type.
     *
     * @param jsonBytes The UTF-8 encoded JSON document.
     * @param valueType The target type.
     * @param <T>       The target type.
     *
     * @return The parsed object.
     *
     * @throws se.nbis.sda.pipeline.exception.json.JsonParsingException if the bytes are not valid JSON or do not
     *                                                                  bind to {@code valueType}.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
