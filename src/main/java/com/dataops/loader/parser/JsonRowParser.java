package com.dataops.loader.parser;

import com.dataops.loader.exception.FatalParseException;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.Row;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * JSON parser. The root must be an array whose elements are all objects.
 *
 * Null and missing properties are absent. Scalars keep their textual form;
 * decimals are written without exponent. Nested objects and arrays become
 * canonical JSON text with keys sorted, since target columns are flat.
 */
public class JsonRowParser implements FileParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonRowParser.class);

    private final ObjectMapper mapper;

    public JsonRowParser(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    @Override
    public FileType getFileType() {
        return FileType.JSON;
    }

    @Override
    public ParsedFile parse(StreamSource source) throws IOException {
        Set<String> keys = new LinkedHashSet<>();
        long rowCount = 0;

        try (JsonParser parser = openArray(source)) {
            JsonToken token;
            while ((token = nextToken(parser)) != JsonToken.END_ARRAY) {
                rowCount++;
                if (token != JsonToken.START_OBJECT) {
                    throw new FatalParseException("JSON array element " + rowCount + " is not an object",
                            line(parser.getCurrentLocation()));
                }
                JsonNode node = readObject(parser);
                node.fieldNames().forEachRemaining(keys::add);
            }
            if (nextToken(parser) != null) {
                throw new FatalParseException("Unexpected content after the JSON array",
                        line(parser.getCurrentLocation()));
            }
        }

        logger.debug("JSON framing OK: {} objects, {} distinct keys", rowCount, keys.size());
        return new ParsedFile(keys.stream().toList(), rowCount, 0, () -> new JsonIterator(openArray(source)));
    }

    private JsonParser openArray(StreamSource source) throws IOException {
        JsonParser parser = mapper.getFactory().createParser(source.open());
        try {
            JsonToken first = nextToken(parser);
            if (first == null) {
                throw new FatalParseException("JSON file is empty");
            }
            if (first != JsonToken.START_ARRAY) {
                throw new FatalParseException("JSON root must be an array of objects, found " + first,
                        line(parser.getCurrentLocation()));
            }
            return parser;
        } catch (IOException | RuntimeException e) {
            parser.close();
            throw e;
        }
    }

    private static JsonToken nextToken(JsonParser parser) throws IOException {
        try {
            return parser.nextToken();
        } catch (JsonProcessingException e) {
            throw invalidJson(e);
        }
    }

    private JsonNode readObject(JsonParser parser) throws IOException {
        try {
            return mapper.readTree(parser);
        } catch (JsonProcessingException e) {
            throw invalidJson(e);
        }
    }

    private static FatalParseException invalidJson(JsonProcessingException e) {
        return new FatalParseException("Invalid JSON: " + e.getOriginalMessage(), line(e.getLocation()), e);
    }

    private static long line(JsonLocation location) {
        return location != null ? Math.max(location.getLineNr(), 0) : 0;
    }

    Row toRow(long rowNumber, JsonNode node) throws JsonProcessingException {
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), toValue(field.getValue()));
        }
        return new Row(rowNumber, values);
    }

    private String toValue(JsonNode value) throws JsonProcessingException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isContainerNode()) {
            Object plain = mapper.treeToValue(value, Object.class);
            return mapper.writeValueAsString(plain);
        }
        if (value.isBigDecimal()) {
            return value.decimalValue().toPlainString();
        }
        return value.asText();
    }

    private final class JsonIterator implements RowIterator {

        private final JsonParser parser;
        private Row pending;
        private long rowNumber;
        private boolean done;

        private JsonIterator(JsonParser parser) {
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !done) {
                try {
                    JsonToken token = nextToken(parser);
                    if (token == JsonToken.START_OBJECT) {
                        pending = toRow(++rowNumber, readObject(parser));
                    } else {
                        done = true;
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return pending != null;
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Row row = pending;
            pending = null;
            return row;
        }

        @Override
        public void close() {
            try {
                parser.close();
            } catch (IOException e) {
                logger.debug("Failed to close JSON parser: {}", e.getMessage());
            }
        }
    }
}
