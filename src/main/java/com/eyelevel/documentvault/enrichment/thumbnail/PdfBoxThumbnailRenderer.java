package com.eyelevel.documentvault.enrichment.thumbnail;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Set;

/**
 * Renders the first page of a PDF with PDFBox, or scales a raster image with ImageIO.
 */
@Slf4j
@Component
public class PdfBoxThumbnailRenderer implements ThumbnailRenderer {

    private static final String PDF_MIME_TYPE = "application/pdf";
    private static final Set<String> IMAGE_MIME_TYPES = Set.of("image/png", "image/jpeg", "image/gif", "image/bmp");
    private static final float RENDER_DPI = 72f;

    @Override
    public boolean supports(String mimeType) {
        return mimeType != null
               && (PDF_MIME_TYPE.equalsIgnoreCase(mimeType) || IMAGE_MIME_TYPES.contains(mimeType.toLowerCase()));
    }

    @Override
    public byte[] renderPng(byte[] content, String mimeType, int width) throws IOException {
        BufferedImage source = PDF_MIME_TYPE.equalsIgnoreCase(mimeType) ? renderFirstPage(content) : readImage(content);
        int height = Math.max(1, (int) Math.round(source.getHeight() * (width / (double) source.getWidth())));

        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(scaled, "png", out);
        log.debug("Rendered {}x{} thumbnail from {}.", width, height, mimeType);
        return out.toByteArray();
    }

    private static BufferedImage renderFirstPage(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.getNumberOfPages() == 0) {
                throw new IOException("PDF has no pages");
            }
            return new PDFRenderer(document).renderImageWithDPI(0, RENDER_DPI, ImageType.RGB);
        }
    }

    private static BufferedImage readImage(byte[] content) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image");
        }
        return image;
    }
}
