package se.nbis.sda.pipeline.common.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.common.json.JsonSerializer;
import se.nbis.sda.pipeline.exception.json.JsonParsingException;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> byte[] serializeToBytes(T object) {
        log.debug("Serializing {} to JSON bytes", object.getClass().getSimpleName());
        try {
            return objectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON bytes", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
