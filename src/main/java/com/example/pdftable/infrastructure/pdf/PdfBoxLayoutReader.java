package com.example.pdftable.infrastructure.pdf;

import com.example.pdftable.config.TableExtractionProperties;
import com.example.pdftable.domain.model.LayoutShape;
import com.example.pdftable.domain.model.PageLayout;
import com.example.pdftable.domain.model.TextFragment;
import com.example.pdftable.infrastructure.exception.DocumentLayoutException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that turns one PDFBox page into a {@link PageLayout}.
 * Text is collected word by word from {@link PDFTextStripper}; words sharing a baseline and separated by no more
 * than the configured join gap become one fragment. Rectangles and lines are collected by
 * {@link PdfBoxShapeCollector}.
 */
@Component
public class PdfBoxLayoutReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxLayoutReader.class);

    private final TableExtractionProperties properties;

    public PdfBoxLayoutReader(TableExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * Reads the text fragments and shapes of one page.
     *
     * @param document  loaded PDF document
     * @param pageIndex zero-based page index
     * @return layout of the page, possibly without fragments
     * @throws DocumentLayoutException when PDFBox cannot process the page content
     */
    public PageLayout readPage(PDDocument document, int pageIndex) {
        int pageNumber = pageIndex + 1;
        try {
            PDPage page = document.getPage(pageIndex);
            PDRectangle cropBox = page.getCropBox();

            FragmentStripper stripper = new FragmentStripper(cropBox, properties.getFragmentJoinGap());
            stripper.setSortByPosition(true);
            stripper.setShouldSeparateByBeads(true);
            stripper.setSuppressDuplicateOverlappingText(false);
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            stripper.getText(document);
            List<TextFragment> fragments = stripper.getFragments();

            PdfBoxShapeCollector shapeCollector = new PdfBoxShapeCollector(page);
            shapeCollector.processPage(page);
            List<LayoutShape> shapes = shapeCollector.getShapes();

            log.debug("Page {}: {} fragment(s), {} shape(s)", pageNumber, fragments.size(), shapes.size());
            return new PageLayout(pageNumber, cropBox.getHeight(), fragments, shapes);
        } catch (IOException e) {
            throw new DocumentLayoutException(pageNumber, e);
        }
    }

    /**
     * Collects word runs with their bounding boxes, flipping PDFBox's top-left text coordinates into the
     * bottom-left page space.
     */
    private static final class FragmentStripper extends PDFTextStripper {
        private static final float BASELINE_TOLERANCE = 1f;

        private final PDRectangle cropBox;
        private final float joinGap;
        private final List<TextFragment> fragments = new ArrayList<>();
        private TextFragment pending;

        FragmentStripper(PDRectangle cropBox, float joinGap) throws IOException {
            this.cropBox = cropBox;
            this.joinGap = joinGap;
        }

        List<TextFragment> getFragments() {
            flushPending();
            return new ArrayList<>(fragments);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (text != null && textPositions != null && !textPositions.isEmpty()) {
                TextFragment fragment = toFragment(text, textPositions);
                if (fragment.hasText()) {
                    append(fragment);
                }
            }
            super.writeString(text, textPositions);
        }

        @Override
        protected void writeLineSeparator() throws IOException {
            flushPending();
            super.writeLineSeparator();
        }

        private TextFragment toFragment(String text, List<TextPosition> textPositions) {
            float left = Float.MAX_VALUE;
            float right = -Float.MAX_VALUE;
            float baseline = -Float.MAX_VALUE;
            float top = Float.MAX_VALUE;
            for (TextPosition position : textPositions) {
                left = Math.min(left, position.getXDirAdj());
                right = Math.max(right, position.getXDirAdj() + position.getWidthDirAdj());
                baseline = Math.max(baseline, position.getYDirAdj());
                top = Math.min(top, position.getYDirAdj() - position.getHeightDir());
            }
            float height = cropBox.getHeight();
            float originX = cropBox.getLowerLeftX();
            float originY = cropBox.getLowerLeftY();
            return new TextFragment(
                    text,
                    originX + left,
                    originY + height - baseline,
                    originX + Math.max(right, left),
                    originY + height - top,
                    height
            );
        }

        private void append(TextFragment fragment) {
            if (pending != null
                    && Math.abs(pending.y0() - fragment.y0()) < BASELINE_TOLERANCE
                    && fragment.x0() >= pending.x0()
                    && fragment.x0() - pending.x1() <= joinGap) {
                pending = new TextFragment(
                        pending.text() + " " + fragment.text(),
                        pending.x0(),
                        Math.min(pending.y0(), fragment.y0()),
                        Math.max(pending.x1(), fragment.x1()),
                        Math.max(pending.y1(), fragment.y1()),
                        pending.pageHeight()
                );
                return;
            }
            flushPending();
            pending = fragment;
        }

        private void flushPending() {
            if (pending != null) {
                fragments.add(pending);
                pending = null;
            }
        }
    }
}
