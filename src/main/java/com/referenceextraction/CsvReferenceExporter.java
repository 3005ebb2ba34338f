package com.referenceextraction;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV output with one row per reference and the flat-record columns as header. The header
 * is written even when there are no references.
 * Fields containing separators, quotes or line breaks are quoted (RFC 4180).
 */
public class CsvReferenceExporter implements ReferenceExporter {

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public void write(List<ExtractedReference> references, Writer out) throws IOException {
        List<String> columns = ExtractedReference.FLAT_RECORD_FIELDS;
        writeRow(out, columns);
        for (ExtractedReference ref : references) {
            Map<String, String> record = ref.toFlatRecord();
            List<String> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(record.get(column));
            }
            writeRow(out, row);
        }
    }

    private static void writeRow(Writer out, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) out.write(',');
            out.write(quote(values.get(i)));
        }
        out.write("\r\n");
    }

    static String quote(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
