package com.example.conservation.etl.reader;

import java.util.Arrays;
import java.util.List;

/**
 * Text content of one filing, split into pages on form feeds.
 */
public class FilingDocument {
    private static final char PAGE_BREAK = '\f';

    private final String fileName;
    private final List<String> pages;

    public FilingDocument(String fileName, String text) {
        this.fileName = fileName;
        this.pages = List.copyOf(Arrays.asList(text.split(String.valueOf(PAGE_BREAK), -1)));
    }

    public String getFileName() {
        return fileName;
    }

    public List<String> getPages() {
        return pages;
    }

    public String getText() {
        return String.join("\n", pages);
    }
}
