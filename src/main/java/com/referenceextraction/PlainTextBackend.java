package com.referenceextraction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads an already extracted UTF-8 text file. Form feeds separate pages.
 * Non-text documents are reported as unsuccessful rather than read as bytes.
 */
public class PlainTextBackend implements TextExtractionBackend {

    public static final String NAME = "plain-text";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RawExtraction extract(Path document) throws IOException {
        String fileName = document.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".pdf")) {
            return RawExtraction.failure(NAME, false, "not a text file: " + document.getFileName());
        }

        String content = Files.readString(document, StandardCharsets.UTF_8);
        String[] rawPages = content.split("\f");
        List<RawExtraction.PageText> pages = new ArrayList<>();
        for (int i = 0; i < rawPages.length; i++) {
            if (!rawPages[i].isBlank()) {
                pages.add(new RawExtraction.PageText(i + 1, rawPages[i]));
            }
        }
        return RawExtraction.success(NAME, false, pages);
    }
}
