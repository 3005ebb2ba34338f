package com.referenceextraction;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text report meant for reading, one block per reference.
 */
public class TextReportExporter implements ReferenceExporter {

    private static final String RULE = "=".repeat(50);

    @Override
    public String format() {
        return "txt";
    }

    @Override
    public void write(List<ExtractedReference> references, Writer out) throws IOException {
        out.write("EXTRACTED REFERENCES\n");
        out.write(RULE + "\n\n");

        for (int i = 0; i < references.size(); i++) {
            ExtractedReference ref = references.get(i);
            out.write("Reference " + (i + 1) + ":\n");
            out.write("Full Text: " + ref.getFullText() + "\n");
            line(out, "Authors", String.join(", ", ref.getAuthors()));
            line(out, "Title", ref.getTitle());
            line(out, "Year", ref.getYear() == null ? "" : ref.getYear().toString());
            line(out, "Venue", ref.getVenue());
            line(out, "Volume", ref.getVolume());
            line(out, "Issue", ref.getIssue());
            line(out, "Pages", ref.getPages());
            line(out, "DOI", ref.getDoi());
            line(out, "URL", ref.getUrl());
            line(out, "ISBN", ref.getIsbn());
            out.write("Type: " + ref.getReferenceType().label() + "\n");
            out.write("Style: " + ref.getCitationStyle().label() + "\n");
            out.write(String.format(Locale.ROOT, "Confidence: %.2f\n", ref.getConfidenceScore()));
            line(out, "Notes", ref.getNotes());
            out.write("-".repeat(30) + "\n\n");
        }
    }

    // Empty fields are left out.
    private static void line(Writer out, String label, String value) throws IOException {
        if (value != null && !value.isEmpty()) {
            out.write(label + ": " + value + "\n");
        }
    }
}
