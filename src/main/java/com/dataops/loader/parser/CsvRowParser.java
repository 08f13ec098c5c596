package com.dataops.loader.parser;

import com.dataops.loader.exception.FatalParseException;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * CSV parser. The first record is the header; header names are trimmed,
 * field values are kept as read.
 *
 * Missing trailing fields are absent (null). Fields beyond the header are
 * ignored and counted as warnings.
 */
public class CsvRowParser implements FileParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvRowParser.class);

    private static final int MAX_LOGGED_WARNINGS = 10;

    private final char delimiter;

    public CsvRowParser(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public FileType getFileType() {
        return FileType.CSV;
    }

    @Override
    public ParsedFile parse(StreamSource source) throws IOException {
        List<String> header;
        long rowCount = 0;
        int warnings = 0;

        try (CsvRecordReader reader = openReader(source)) {
            header = readHeader(reader);
            List<String> record;
            while ((record = reader.next()) != null) {
                rowCount++;
                if (record.size() > header.size()) {
                    warnings++;
                    if (warnings <= MAX_LOGGED_WARNINGS) {
                        logger.warn("Row {} (line {}) has {} fields, header has {}; extra fields ignored",
                                rowCount, reader.getRecordLine(), record.size(), header.size());
                    }
                }
            }
        }

        if (warnings > MAX_LOGGED_WARNINGS) {
            logger.warn("{} rows in total had more fields than the header", warnings);
        }
        logger.debug("CSV framing OK: {} columns, {} rows, {} warnings", header.size(), rowCount, warnings);

        final List<String> columns = header;
        return new ParsedFile(header, rowCount, warnings, () -> new CsvIterator(openReader(source), columns));
    }

    private CsvRecordReader openReader(StreamSource source) throws IOException {
        InputStream inputStream = source.open();
        return new CsvRecordReader(
                new BufferedReader(new InputStreamReader(inputStream, strictUtf8())), delimiter);
    }

    private static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static List<String> readHeader(CsvRecordReader reader) throws IOException {
        List<String> record = reader.next();
        if (record == null) {
            throw new FatalParseException("CSV file is empty or has no header");
        }

        List<String> header = new ArrayList<>(record.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < record.size(); i++) {
            String name = record.get(i).trim();
            if (name.isEmpty()) {
                throw new FatalParseException("Empty column name at header position " + (i + 1),
                        reader.getRecordLine());
            }
            if (!seen.add(name)) {
                throw new FatalParseException("Duplicate column name in header: " + name, reader.getRecordLine());
            }
            header.add(name);
        }
        return header;
    }

    private static Row toRow(long rowNumber, List<String> header, List<String> record) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            values.put(header.get(i), i < record.size() ? record.get(i) : null);
        }
        return new Row(rowNumber, values);
    }

    private static final class CsvIterator implements RowIterator {

        private final CsvRecordReader reader;
        private final List<String> header;
        private List<String> pending;
        private long rowNumber;
        private boolean done;

        private CsvIterator(CsvRecordReader reader, List<String> header) throws IOException {
            this.reader = reader;
            this.header = header;
            try {
                reader.next(); // header, already validated
            } catch (IOException | RuntimeException e) {
                close();
                throw e;
            }
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !done) {
                try {
                    pending = reader.next();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                done = pending == null;
            }
            return pending != null;
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<String> record = pending;
            pending = null;
            return toRow(++rowNumber, header, record);
        }

        @Override
        public void close() {
            try {
                reader.close();
            } catch (IOException e) {
                logger.debug("Failed to close CSV reader: {}", e.getMessage());
            }
        }
    }
}
