package se.nbis.sda.pipeline.common.json;

/**
 * Writes outbound message objects as JSON.
 */
public interface JsonSerializer {

    /**
     * Serializes to UTF-8 bytes, the representation published on the broker.
     *
     * @throws se.nbis.sda.pipeline.exception.json.JsonParsingException if the object cannot be serialized.
     */
    <T> byte[] serializeToBytes(T object);
}
