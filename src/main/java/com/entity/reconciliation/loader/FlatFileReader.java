package com.entity.reconciliation.loader;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.RowResolver;
import com.entity.reconciliation.store.record.SourceRow;
import com.entity.reconciliation.store.record.StoreRecord;
import com.entity.reconciliation.store.record.TypeRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads the tab-separated intermediate format, plain or gzip-compressed ({@code .gz}).
 *
 * <p>The first line is a header: identifier namespace, source name, schema namespace and a
 * JSON array of types ({@code [{"id":..,"name":..,"description":..,"url":..}]}). The first
 * declared type is the default type and its URL template is the store's view URL; without
 * types the default type is {@value StoreMetadata#FALLBACK_TYPE_ID}. Every other line is
 * a row: id, name, comma-separated type ids and a JSON object of attributes.</p>
 */
public class FlatFileReader {
    private static final Logger log = LoggerFactory.getLogger(FlatFileReader.class);

    private static final TypeReference<List<EntityType>> TYPE_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public FlatFileReader() {
        this(new ObjectMapper());
    }

    public FlatFileReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads a whole file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the header or a row is malformed; the message names the line
     */
    public FlatFile read(Path path) throws IOException {
        try (InputStream in = open(path)) {
            FlatFile file = read(in);
            log.info("flatfile.read path={} records={}", path, file.records().size());
            return file;
        }
    }

    public FlatFile read(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        StoreMetadata metadata = null;
        RowResolver resolver = null;
        List<StoreRecord> records = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] columns = line.split("\t", 4);
            if (metadata == null) {
                List<EntityType> types = parseTypes(columns, lineNumber);
                metadata = new StoreMetadata(
                        column(columns, 1),
                        column(columns, 0),
                        column(columns, 2),
                        types.isEmpty() ? "" : types.get(0).viewUrlTemplate(),
                        types.isEmpty() ? null : types.get(0).id());
                resolver = new RowResolver(metadata.defaultTypeId());
                for (EntityType type : types) {
                    records.add(new TypeRecord(type));
                }
                continue;
            }
            records.add(resolveRow(resolver, columns, lineNumber));
        }

        if (metadata == null) {
            throw new IllegalArgumentException("Source has no header line");
        }
        return new FlatFile(metadata, records);
    }

    private StoreRecord resolveRow(RowResolver resolver, String[] columns, int lineNumber) {
        if (columns.length != 4 || columns[3].isEmpty()) {
            throw new IllegalArgumentException("Line " + lineNumber + ": expected 4 tab-separated columns");
        }
        Map<String, Object> attributes;
        try {
            attributes = "{}".equals(columns[3]) ? Map.of() : mapper.readValue(columns[3], ATTRIBUTES);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": invalid attribute JSON: "
                    + e.getOriginalMessage(), e);
        }
        try {
            return resolver.resolve(new SourceRow(columns[0], columns[1], columns[2], attributes));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private List<EntityType> parseTypes(String[] columns, int lineNumber) {
        String json = column(columns, 3).trim();
        if (json.isEmpty()) {
            return List.of();
        }
        try {
            List<EntityType> types = mapper.readValue(json, TYPE_LIST);
            return types != null ? types : List.of();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": invalid type list JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static String column(String[] columns, int index) {
        return index < columns.length ? columns[index] : "";
    }

    private static InputStream open(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        if (path.getFileName().toString().endsWith(".gz")) {
            try {
                return new GZIPInputStream(in);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return in;
    }
}
