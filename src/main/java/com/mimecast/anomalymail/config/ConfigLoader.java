package com.mimecast.anomalymail.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON5 configuration file reader.
 *
 * <p>Reads files with comments, unquoted keys and single quoted strings into plain maps.
 * <br>Integral numbers are read as Long so schema validation can tell them apart from fractions.
 */
public final class ConfigLoader {

    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

    private static final Gson gson = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    /**
     * Private constructor.
     */
    private ConfigLoader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads configuration file.
     *
     * @param path File path.
     * @return Configuration map.
     * @throws ConfigException Unable to read or parse file.
     */
    public static Map<String, Object> read(String path) throws ConfigException {
        Path file = Paths.get(path);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException(path, "unable to read file: " + e.getMessage(), e);
        }

        return parse(path, content);
    }

    /**
     * Parses configuration string.
     *
     * @param source  Source name used in errors.
     * @param content JSON5 string.
     * @return Configuration map, empty if content is blank.
     * @throws ConfigException Unable to parse content.
     */
    public static Map<String, Object> parse(String source, String content) throws ConfigException {
        try (Reader reader = new StringReader(content)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> map = gson.fromJson(jsonReader, MAP_TYPE);
            return map != null ? map : new LinkedHashMap<>();
        } catch (JsonParseException | IOException | IllegalStateException e) {
            throw new ConfigException(source, "invalid JSON5: " + e.getMessage(), e);
        }
    }
}
