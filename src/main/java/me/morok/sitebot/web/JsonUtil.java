package me.morok.sitebot.web;

import com.fasterxml.jackson.databind.ObjectMapper;

public class JsonUtil {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonUtil() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
