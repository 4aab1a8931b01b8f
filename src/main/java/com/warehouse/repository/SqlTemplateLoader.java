package com.warehouse.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named SQL statements read from a single classpath file. Each statement is
 * introduced by a {@code -- name: <queryName>} line and runs until the next one.
 * The file is parsed once, at construction, so lookups are safe from any thread.
 */
@Component
@Slf4j
public class SqlTemplateLoader {

    public static final String DEFAULT_LOCATION = "classpath:sql/queries.sql";

    private static final String NAME_MARKER = "-- name:";

    private final String location;
    private final Map<String, String> queries;

    @Autowired
    public SqlTemplateLoader(ResourceLoader resourceLoader,
                             @Value("${app.inventory.queries-location:" + DEFAULT_LOCATION + "}") String location) {
        this.location = location;
        this.queries = parse(resourceLoader.getResource(location));
        log.info("Loaded {} named queries from {}", queries.size(), location);
    }

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    public String load(String name) {
        String query = queries.get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    public Set<String> names() {
        return queries.keySet();
    }

    private static Map<String, String> parse(Resource resource) {
        Map<String, String> parsed = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String currentName = null;
            StringBuilder sb = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    putQuery(parsed, currentName, sb);
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    sb = new StringBuilder();
                } else if (currentName != null && !trimmed.startsWith("--")) {
                    sb.append(line).append('\n');
                }
            }
            putQuery(parsed, currentName, sb);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + resource.getDescription(), e);
        }
        return Collections.unmodifiableMap(parsed);
    }

    private static void putQuery(Map<String, String> parsed, String name, StringBuilder sb) {
        if (name == null) {
            return;
        }
        String sql = sb.toString().trim();
        if (sql.isEmpty()) {
            throw new IllegalStateException("Named query has no statement: " + name);
        }
        if (parsed.put(name, sql) != null) {
            throw new IllegalStateException("Duplicate named query: " + name);
        }
    }
}
