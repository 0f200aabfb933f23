package fun.fengwk.scholar.core.service.crawl.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of progress messages, snake_case fields and ISO-8601 instants.
 *
 * @author fengwk
 */
@Component
public class ProgressMessageCodec {

    private final ObjectMapper objectMapper;

    public ProgressMessageCodec() {
        this.objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    public String encode(ProgressEventKind kind, JobSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(new ProgressMessage(kind, snapshot));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to encode progress message: " + ex.getMessage(), ex);
        }
    }

}
