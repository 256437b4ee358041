package com.linkscout.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rendersEventAndKeyValues() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class)
                .toJson(Level.INFO, "seed-start", null, "seed", "http://a.test", "depth", 2);

        JsonNode n = mapper.readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("seed-start");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("seed").asText()).isEqualTo("http://a.test");
        assertThat(n.get("depth").asInt()).isEqualTo(2);
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    void oddKeyValuesAreFlagged() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class).toJson(Level.WARNING, "x", null, "dangling");
        assertThat(mapper.readTree(line).get("_kv_mismatch").asBoolean()).isTrue();
    }

    @Test
    void errorCarriesExceptionType() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class)
                .toJson(Level.SEVERE, "boom", new IllegalStateException("bad"));
        JsonNode n = mapper.readTree(line);
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("bad");
    }
}
