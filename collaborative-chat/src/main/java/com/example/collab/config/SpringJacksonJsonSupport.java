package com.example.collab.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Socket payloads must render {@code Instant}s exactly like the REST responses, so the socket mapper mirrors the
 * Spring one.
 */
public class SpringJacksonJsonSupport extends JacksonJsonSupport {

    public SpringJacksonJsonSupport(ObjectMapper springMapper) {
        super(new JavaTimeModule());
        objectMapper.configure(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                springMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        objectMapper.configure(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                springMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        objectMapper.setTimeZone(springMapper.getSerializationConfig().getTimeZone());
        objectMapper.setSerializationInclusion(
                springMapper.getSerializationConfig().getDefaultPropertyInclusion().getValueInclusion());
    }
}
