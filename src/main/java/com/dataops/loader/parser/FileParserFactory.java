package com.dataops.loader.parser;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.model.FileType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Provides the parser for a declared file type.
 */
@Component
public class FileParserFactory {

    private final CsvRowParser csvParser;
    private final JsonRowParser jsonParser;

    public FileParserFactory(LoaderProperties properties, ObjectMapper objectMapper) {
        this.csvParser = new CsvRowParser(properties.getCsv().getDelimiterChar());
        this.jsonParser = new JsonRowParser(objectMapper);
    }

    public FileParser forType(FileType fileType) {
        return switch (fileType) {
            case CSV -> csvParser;
            case JSON -> jsonParser;
        };
    }
}
