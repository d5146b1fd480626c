package com.example.pdftable.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Builds small in-memory PDFs with text placed at exact coordinates.
 */
public final class TestPdfs {

    public static final float FONT_SIZE = 12f;

    private TestPdfs() {
    }

    /**
     * One text run drawn with its baseline origin at {@code (x, y)}, bottom-left page coordinates.
     */
    public record Text(float x, float y, String value) {
    }

    public static Text text(float x, float y, String value) {
        return new Text(x, y, value);
    }

    /**
     * Creates a letter-sized PDF with one page per list; an empty list produces a blank page.
     *
     * @param pages text runs of each page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    @SafeVarargs
    public static byte[] pdf(List<Text>... pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<Text> texts : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    for (Text text : texts) {
                        contentStream.beginText();
                        contentStream.setFont(font, FONT_SIZE);
                        contentStream.newLineAtOffset(text.x(), text.y());
                        contentStream.showText(text.value());
                        contentStream.endText();
                    }
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
