package com.hogfeatures.extractor.visual;

import com.hogfeatures.extractor.GrayImage;
import com.hogfeatures.extractor.InvalidArgumentException;
import com.hogfeatures.extractor.histogram.CellHistogramGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VisualizerTest {

    @Test
    public void testSameShapeAsImage() {
        CellHistogramGrid cells = new CellHistogramGrid(1, 2, 4, new double[] { 1, 0, 0, 0, 0, 0, 2, 0 });
        GrayImage img = new Visualizer().render(cells, 19, 11, 8, 8, false);
        assertEquals(19, img.getWidth());
        assertEquals(11, img.getHeight());
    }

    @Test
    public void testSegmentThroughCellCenter() {
        // One cell, 4 bins over 180 degrees; only bin 2 (center 112.5) is set.
        CellHistogramGrid cells = new CellHistogramGrid(1, 1, 4, new double[] { 0, 0, 5, 0 });
        GrayImage img = new Visualizer().render(cells, 9, 9, 9, 9, false);

        // Center pixel (4,4) at full intensity.
        assertEquals(1.0, img.get(4, 4), 0.0);
        // radius = 9/2 - 1 = 3; step 3 along (sin, cos)(112.5) = (0.924, -0.383) -> (3, -1)
        assertEquals(1.0, img.get(7, 3), 0.0);
        assertEquals(1.0, img.get(1, 5), 0.0);
        // Perpendicular direction stays dark.
        assertEquals(0.0, img.get(4, 7), 0.0);
    }

    @Test
    public void testRelativeIntensityAndClipping() {
        // Bin 0 (22.5 deg) has twice the weight of bin 2 (112.5 deg).
        CellHistogramGrid cells = new CellHistogramGrid(1, 1, 4, new double[] { 4, 0, 2, 0 });
        GrayImage img = new Visualizer().render(cells, 9, 9, 9, 9, false);

        // Off-center pixel on bin 0's segment: step 3 along (0.383, 0.924) -> (1, 3)
        assertEquals(1.0, img.get(5, 7), 1e-12);
        // Off-center pixel on bin 2's segment
        assertEquals(0.5, img.get(7, 3), 1e-12);
        // Center gets 1.0 + 0.5 but is clipped
        assertEquals(1.0, img.get(4, 4), 0.0);

        GrayImage bright = new Visualizer(2.0).render(cells, 9, 9, 9, 9, false);
        assertEquals(1.5, bright.get(4, 4), 1e-12);
        for (double v : img.toArray()) {
            assertTrue(v >= 0.0 && v <= 1.0);
        }
    }

    @Test
    public void testEmptyHistogramsLeaveBlankCanvas() {
        CellHistogramGrid cells = new CellHistogramGrid(2, 2, 9, new double[36]);
        GrayImage img = new Visualizer().render(cells, 8, 8, 4, 4, false);
        for (double v : img.toArray()) {
            assertEquals(0.0, v, 0.0);
        }
    }

    @Test
    public void testOrientedLinesHaveUniqueOffsets() {
        int[][][] lines = Visualizer.orientedLines(9, 5, 180.0);
        assertEquals(9, lines.length);
        for (int[][] line : lines) {
            assertEquals(11, line.length);
            for (int i = 0; i < line.length; i++) {
                for (int j = i + 1; j < line.length; j++) {
                    assertFalse(line[i][0] == line[j][0] && line[i][1] == line[j][1]);
                }
            }
        }
        // Radius zero is a single point.
        assertEquals(1, Visualizer.orientedLines(4, 0, 180.0)[0].length);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(InvalidArgumentException.class, () -> new Visualizer(0.0));
        CellHistogramGrid cells = new CellHistogramGrid(0, 0, 9, new double[0]);
        assertThrows(InvalidArgumentException.class, () -> new Visualizer().render(cells, 0, 4, 4, 4, false));
    }
}
