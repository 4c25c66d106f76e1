package de.htwsaar.ministream.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    record Sample(String key, long size) {}

    @Test
    void testToJson() {
        String json = JacksonCodec.toJson(new Sample("abc", 42));

        assertNotNull(json);
        assertTrue(json.contains("\"key\":\"abc\""));
        assertTrue(json.contains("\"size\":42"));
    }

    @Test
    void testFromJsonBytes() {
        byte[] json = JacksonCodec.toJsonBytes(new Sample("def", 7));

        Sample sample = JacksonCodec.fromJson(json, Sample.class);

        assertEquals("def", sample.key());
        assertEquals(7, sample.size());
    }

    @Test
    void testFromJson_InvalidJson_ThrowsException() {
        // Kein gültiges JSON
        String invalidJson = "{key: kaputt}";
        assertThrows(MiniStreamSerializationException.class, () -> JacksonCodec.fromJson(invalidJson, Sample.class));
    }
}
