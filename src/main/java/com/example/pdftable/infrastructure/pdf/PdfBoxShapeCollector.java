package com.example.pdftable.infrastructure.pdf;

import com.example.pdftable.domain.model.LayoutShape;
import com.example.pdftable.domain.model.ShapeKind;

import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

/**
 * Records the rectangles and straight line segments painted on a page.
 * Path construction operators arrive already transformed by the CTM, so coordinates are in page space with the
 * origin at the bottom-left corner. Segments are buffered per path and kept only when the path is stroked or
 * filled; paths ended without painting (clipping paths) are discarded.
 */
class PdfBoxShapeCollector extends PDFGraphicsStreamEngine {

    private final List<LayoutShape> shapes = new ArrayList<>();
    private final List<LayoutShape> currentPath = new ArrayList<>();
    private final Point2D.Float currentPoint = new Point2D.Float();

    PdfBoxShapeCollector(PDPage page) {
        super(page);
    }

    List<LayoutShape> getShapes() {
        return List.copyOf(shapes);
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
        float minX = (float) Math.min(Math.min(p0.getX(), p1.getX()), Math.min(p2.getX(), p3.getX()));
        float maxX = (float) Math.max(Math.max(p0.getX(), p1.getX()), Math.max(p2.getX(), p3.getX()));
        float minY = (float) Math.min(Math.min(p0.getY(), p1.getY()), Math.min(p2.getY(), p3.getY()));
        float maxY = (float) Math.max(Math.max(p0.getY(), p1.getY()), Math.max(p2.getY(), p3.getY()));
        currentPath.add(new LayoutShape(ShapeKind.RECTANGLE, minX, minY, maxX, maxY));
        currentPoint.setLocation(p0.getX(), p0.getY());
    }

    @Override
    public void moveTo(float x, float y) {
        currentPoint.setLocation(x, y);
    }

    @Override
    public void lineTo(float x, float y) {
        currentPath.add(new LayoutShape(
                ShapeKind.LINE,
                Math.min(currentPoint.x, x),
                Math.min(currentPoint.y, y),
                Math.max(currentPoint.x, x),
                Math.max(currentPoint.y, y)
        ));
        currentPoint.setLocation(x, y);
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
        currentPoint.setLocation(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() {
        return (Point2D) currentPoint.clone();
    }

    @Override
    public void strokePath() {
        commitPath();
    }

    @Override
    public void fillPath(int windingRule) {
        commitPath();
    }

    @Override
    public void fillAndStrokePath(int windingRule) {
        commitPath();
    }

    @Override
    public void endPath() {
        currentPath.clear();
    }

    // W only marks the path as a clip; the following n or paint operator decides its fate
    @Override
    public void clip(int windingRule) {
    }

    @Override
    public void closePath() {
    }

    @Override
    public void drawImage(PDImage pdImage) {
    }

    @Override
    public void shadingFill(COSName shadingName) {
    }

    private void commitPath() {
        shapes.addAll(currentPath);
        currentPath.clear();
    }
}
