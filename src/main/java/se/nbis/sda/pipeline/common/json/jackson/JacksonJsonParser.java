package se.nbis.sda.pipeline.common.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.common.json.JsonParser;
import se.nbis.sda.pipeline.exception.json.JsonParsingException;

import java.io.IOException;

/**
 * Jackson based {@link JsonParser}. Missing primitives and trailing garbage are treated as parse errors
 * so that a message only binds when its document is complete.
 */
@Slf4j
@Component("jacksonJsonParser")
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    public JacksonJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty JSON document", null);
        }
        ObjectReader reader = objectMapper.readerFor(valueType)
                                          .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                                          .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                                          .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            T result = reader.readValue(jsonBytes);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (JsonProcessingException e) {
            log.debug("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON byte array: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new JsonParsingException("Error reading JSON byte array", e);
        }
    }
}
