package com.referenceextraction;

import java.io.IOException;
import java.io.Writer;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown report: a summary section followed by a field table for each reference.
 */
public class MarkdownReferenceExporter implements ReferenceExporter {

    @Override
    public String format() {
        return "md";
    }

    @Override
    public void write(List<ExtractedReference> references, Writer out) throws IOException {
        out.write("# Extracted References\n\n");
        out.write("## Summary\n\n");
        out.write("- Total references: " + references.size() + "\n");
        out.write(String.format(Locale.ROOT, "- Average confidence: %.2f\n",
                ProcessingStatistics.average(references)));

        Map<ExtractedReference.ReferenceType, Integer> byType = new EnumMap<>(ExtractedReference.ReferenceType.class);
        for (ExtractedReference ref : references) {
            byType.merge(ref.getReferenceType(), 1, Integer::sum);
        }
        for (Map.Entry<ExtractedReference.ReferenceType, Integer> e : byType.entrySet()) {
            out.write("- " + e.getKey().label() + ": " + e.getValue() + "\n");
        }
        out.write("\n## References\n");

        for (int i = 0; i < references.size(); i++) {
            ExtractedReference ref = references.get(i);
            out.write("\n### " + (i + 1) + ". " + escape(ref.getTitle().isEmpty() ? "Untitled" : ref.getTitle()) + "\n\n");
            out.write("> " + escape(ref.getFullText()) + "\n\n");
            out.write("| Field | Value |\n");
            out.write("|-------|-------|\n");
            for (Map.Entry<String, String> field : ref.toFlatRecord().entrySet()) {
                if (field.getKey().equals("full_text") || field.getValue().isEmpty()) {
                    continue;
                }
                out.write("| " + field.getKey() + " | " + escape(field.getValue()) + " |\n");
            }
        }
    }

    static String escape(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
