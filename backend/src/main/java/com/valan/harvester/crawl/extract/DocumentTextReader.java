package com.valan.harvester.crawl.extract;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Turns a downloaded award document into plain text. PDFs go through PDFBox, page by
 * page in reading order; anything else is treated as UTF-8 text.
 */
public class DocumentTextReader {
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    public String read(byte[] document) throws IOException {
        if (document == null || document.length == 0) {
            return "";
        }
        if (!isPdf(document)) {
            return new String(document, StandardCharsets.UTF_8);
        }
        try (PDDocument pdf = PDDocument.load(document)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            stripper.setPageEnd("\n");
            return stripper.getText(pdf);
        }
    }

    static boolean isPdf(byte[] document) {
        if (document.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (document[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
