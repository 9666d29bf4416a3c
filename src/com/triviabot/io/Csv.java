package com.triviabot.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal CSV reading and writing: comma separated, double-quoted fields with {@code ""} escapes,
 * quoted fields may span lines.
 */
final class Csv {

    private Csv() {
    }

    /**
     * Reads records from a reader while keeping track of the line a record starts on.
     */
    static final class RecordReader {
        private final BufferedReader in;
        private int lineNumber;
        private int recordLine;

        RecordReader(BufferedReader in) {
            this.in = in;
        }

        /**
         * @return the fields of the next record, or null at end of input
         */
        List<String> next() throws IOException {
            String line = in.readLine();
            if (line == null) {
                return null;
            }
            lineNumber++;
            recordLine = lineNumber;

            List<String> fields = new ArrayList<>();
            StringBuilder field = new StringBuilder();
            boolean quoted = false;
            while (true) {
                for (int i = 0; i < line.length(); i++) {
                    char c = line.charAt(i);
                    if (quoted) {
                        if (c == '"') {
                            if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                                field.append('"');
                                i++;
                            } else {
                                quoted = false;
                            }
                        } else {
                            field.append(c);
                        }
                    } else if (c == '"') {
                        quoted = true;
                    } else if (c == ',') {
                        fields.add(field.toString());
                        field.setLength(0);
                    } else {
                        field.append(c);
                    }
                }
                if (!quoted) {
                    break;
                }
                line = in.readLine();
                if (line == null) {
                    throw new IOException("Line " + recordLine + ": unterminated quoted field");
                }
                lineNumber++;
                field.append('\n');
            }
            fields.add(field.toString());
            return fields;
        }

        /**
         * Line on which the last returned record started (1-based).
         */
        int recordLine() {
            return recordLine;
        }
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    static String join(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(fields.get(i)));
        }
        return sb.toString();
    }
}
