package com.dataops.loader.parser;

import com.dataops.loader.exception.FatalParseException;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads RFC 4180 records from a character stream.
 *
 * Quoted fields may contain the delimiter, line breaks and doubled quotes.
 * Records end at {@code \n}, {@code \r\n} or a lone {@code \r}. Empty lines
 * are skipped. A quote inside an unquoted field is kept as a literal character.
 * An unterminated quoted field, or any character other than a delimiter or line
 * break after a closing quote, raises {@link FatalParseException}. So do bytes
 * the underlying reader cannot decode, when it reports them.
 */
class CsvRecordReader implements AutoCloseable {

    private static final int EOF = -1;
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private enum State {
        FIELD_START, UNQUOTED, QUOTED, AFTER_QUOTE
    }

    private final PushbackReader reader;
    private final char delimiter;
    private long line = 1; // physical line the next character belongs to
    private long recordLine; // physical line where the last record started
    private boolean started;

    CsvRecordReader(Reader reader, char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid CSV delimiter: " + delimiter);
        }
        this.reader = new PushbackReader(reader, 1);
        this.delimiter = delimiter;
    }

    /**
     * @return the next non-empty record, or {@code null} at end of input
     */
    List<String> next() throws IOException {
        try {
            return nextRecord();
        } catch (CharacterCodingException e) {
            // The decoder reads ahead, so the line of the bad bytes is not known
            throw new FatalParseException("Source file is not valid UTF-8: " + e.getMessage(), 0, e);
        }
    }

    private List<String> nextRecord() throws IOException {
        if (!started) {
            started = true;
            int first = reader.read();
            if (first != BOM && first != EOF) {
                reader.unread(first);
            }
        }
        while (true) {
            recordLine = line;
            RecordResult result = readRecord();
            if (result == null) {
                return null;
            }
            if (!result.isBlank()) {
                return result.fields;
            }
        }
    }

    /**
     * Physical line on which the record returned by the last {@link #next()} started.
     */
    long getRecordLine() {
        return recordLine;
    }

    private RecordResult readRecord() throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        State state = State.FIELD_START;
        boolean anyQuoted = false;
        long quoteLine = 0;

        int c = reader.read();
        if (c == EOF) {
            return null;
        }

        while (true) {
            switch (state) {
                case FIELD_START, UNQUOTED -> {
                    if (c == EOF || c == '\n' || c == '\r') {
                        fields.add(field.toString());
                        endLine(c);
                        return new RecordResult(fields, anyQuoted);
                    } else if (c == delimiter) {
                        fields.add(field.toString());
                        field.setLength(0);
                        state = State.FIELD_START;
                    } else if (c == QUOTE && state == State.FIELD_START) {
                        state = State.QUOTED;
                        anyQuoted = true;
                        quoteLine = line;
                    } else {
                        field.append((char) c);
                        state = State.UNQUOTED;
                    }
                }
                case QUOTED -> {
                    if (c == EOF) {
                        throw new FatalParseException("Unterminated quoted field", quoteLine);
                    } else if (c == QUOTE) {
                        state = State.AFTER_QUOTE;
                    } else {
                        field.append((char) c);
                        if (c == '\n') {
                            line++;
                        } else if (c == '\r') {
                            int next = reader.read();
                            if (next == '\n') {
                                field.append('\n');
                            } else if (next != EOF) {
                                reader.unread(next);
                            }
                            line++;
                        }
                    }
                }
                case AFTER_QUOTE -> {
                    if (c == QUOTE) {
                        field.append(QUOTE);
                        state = State.QUOTED;
                    } else if (c == delimiter) {
                        fields.add(field.toString());
                        field.setLength(0);
                        state = State.FIELD_START;
                    } else if (c == EOF || c == '\n' || c == '\r') {
                        fields.add(field.toString());
                        endLine(c);
                        return new RecordResult(fields, anyQuoted);
                    } else {
                        throw new FatalParseException(
                                "Unexpected character '" + (char) c + "' after closing quote", line);
                    }
                }
            }
            c = reader.read();
        }
    }

    private void endLine(int c) throws IOException {
        if (c == '\r') {
            int next = reader.read();
            if (next != '\n' && next != EOF) {
                reader.unread(next);
            }
        }
        if (c != EOF) {
            line++;
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static final class RecordResult {
        private final List<String> fields;
        private final boolean anyQuoted;

        private RecordResult(List<String> fields, boolean anyQuoted) {
            this.fields = fields;
            this.anyQuoted = anyQuoted;
        }

        private boolean isBlank() {
            return !anyQuoted && fields.size() == 1 && fields.get(0).isEmpty();
        }
    }
}
