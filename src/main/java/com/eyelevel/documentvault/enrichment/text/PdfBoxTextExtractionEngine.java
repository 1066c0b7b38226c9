package com.eyelevel.documentvault.enrichment.text;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Extracts text from PDFs with PDFBox and reads {@code text/*} payloads as UTF-8.
 */
@Slf4j
@Component
public class PdfBoxTextExtractionEngine implements TextExtractionEngine {

    static final String PDF_MIME_TYPE = "application/pdf";

    @Override
    public boolean supports(String mimeType) {
        return mimeType != null && (PDF_MIME_TYPE.equalsIgnoreCase(mimeType) || mimeType.startsWith("text/"));
    }

    /**
     * Password-protected PDFs yield an empty string rather than an error, since retrying cannot help.
     */
    @Override
    public String extractText(byte[] content, String mimeType) throws IOException {
        if (!PDF_MIME_TYPE.equalsIgnoreCase(mimeType)) {
            return new String(content, StandardCharsets.UTF_8);
        }
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            log.debug("Extracted {} characters from {} PDF page(s).", text.length(), document.getNumberOfPages());
            return text;
        } catch (InvalidPasswordException e) {
            log.warn("PDF is password protected; skipping text extraction.");
            return "";
        }
    }
}
