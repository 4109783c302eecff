package ai.shield.detect.backend;

import ai.shield.detect.DetectorUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

final class BackendReplies {
    private BackendReplies() {}

    /** Extracts the JSON object from a model reply, tolerating code fences and chatter around it. */
    static JsonNode parseObject(String reply, ObjectMapper objectMapper) {
        int start = reply == null ? -1 : reply.indexOf('{');
        int end = reply == null ? -1 : reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new DetectorUnavailableException("backend reply carried no JSON object");
        }
        try {
            return objectMapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new DetectorUnavailableException("backend reply was not valid JSON", e);
        }
    }
}
