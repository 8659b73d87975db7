package com.barthel.tariffshock.adapter.out.reference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads YAML lookup tables and line-based datasets from Spring resource locations.
 */
@Component
@Slf4j
public class ReferenceTableReader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;

    public ReferenceTableReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> T readYaml(String location, TypeReference<T> type) {
        Resource resource = require(location);
        try (InputStream in = resource.getInputStream()) {
            T value = yamlMapper.readValue(in, type);
            if (value == null) {
                throw new IllegalStateException("Reference table is empty: " + location);
            }
            return value;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reference table " + location, e);
        }
    }

    public List<String> readLines(String location) {
        Resource resource = require(location);
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + location, e);
        }
        log.debug("Read {} lines from {}", lines.size(), location);
        return lines;
    }

    private Resource require(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Reference resource not found: " + location);
        }
        return resource;
    }
}
