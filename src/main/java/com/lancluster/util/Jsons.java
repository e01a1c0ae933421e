package com.lancluster.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Shared Jackson mapper. The wire encoding uses the compact form,
 * files on disk use the indented writer.
 */
public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectWriter pretty() {
        return PRETTY;
    }
}
