/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.pixel.convolution;

import org.janelia.pixel.buffer.PixelBuffer;
import org.janelia.pixel.buffer.PixelRow;
import org.janelia.pixel.color.ColorVector;
import org.janelia.pixel.color.ColorVectorUtils;
import org.janelia.pixel.kernel.DenseMatrix;

/**
 * Computes single convolved samples.
 *
 * Source locations outside the working area are clamped to its edge:
 * rows are clamped to [0, maxRow] and columns to [offsetColumn, maxColumn].
 * Target rows are working area relative, so the result for a column is always stored at
 * index {@code column} of the target row while the source is sampled around
 * {@code column + offsetColumn}.
 *
 * @author Eric Trautman
 */
public class Convolver {

    /**
     * Computes the sum of the source samples around (row, column + offsetColumn)
     * weighted by the kernel and stores it in the target row.
     *
     * For {@link ConvolutionPassType#SINGLE} and {@link ConvolutionPassType#SECOND} passes,
     * the alpha value already stored in the target slot is kept and the result is unpremultiplied.
     * {@link ConvolutionPassType#FIRST} results are stored premultiplied (including the summed alpha).
     *
     * @param  matrix        convolution kernel.
     * @param  sourcePixels  source samples.
     * @param  targetRow     row receiving the result.
     * @param  row           current source row.
     * @param  column        current (working area relative) column.
     * @param  maxRow        maximum source row to sample.
     * @param  maxColumn     maximum source column to sample.
     * @param  offsetColumn  first source column of the working area.
     * @param  passType      premultiplication handling for this pass.
     */
    public static void convolve(final DenseMatrix matrix,
                                final PixelBuffer sourcePixels,
                                final PixelRow targetRow,
                                final int row,
                                final int column,
                                final int maxRow,
                                final int maxColumn,
                                final int offsetColumn,
                                final ConvolutionPassType passType) {

        final ColorVector vector = new ColorVector();
        final ColorVector currentColor = new ColorVector();
        final boolean premultiply = passType.isPremultiplySamples();

        final int matrixHeight = matrix.getRows();
        final int matrixWidth = matrix.getColumns();
        final int radiusY = matrixHeight >> 1;
        final int radiusX = matrixWidth >> 1;
        final int sourceOffsetColumnBase = column + offsetColumn;

        for (int y = 0; y < matrixHeight; y++) {

            final int offsetY = clamp(row + y - radiusY, 0, maxRow);
            final PixelRow sourceRow = sourcePixels.getRow(offsetY);

            for (int x = 0; x < matrixWidth; x++) {
                final int offsetX = clamp(sourceOffsetColumnBase + x - radiusX, offsetColumn, maxColumn);
                sourceRow.getColor(offsetX, currentColor);
                if (premultiply) {
                    ColorVectorUtils.premultiply(currentColor);
                }
                vector.addWeighted(matrix.get(y, x), currentColor);
            }
        }

        if (passType.isUnPremultiplyResult()) {
            storeWithTargetAlpha(vector, targetRow, column);
        } else {
            targetRow.setColor(column, vector);
        }
    }

    /**
     * Computes the gradient magnitude {@code sqrt(x*x + y*y)} of the source samples around
     * (row, column + offsetColumn) for two oriented kernels and stores it (unpremultiplied and
     * with the target slot's alpha) in the target row.
     * Each source sample is fetched and premultiplied once and then used for both sums.
     *
     * @throws IllegalArgumentException
     *   if the kernels have different dimensions.
     */
    public static void convolve2D(final DenseMatrix matrixY,
                                  final DenseMatrix matrixX,
                                  final PixelBuffer sourcePixels,
                                  final PixelRow targetRow,
                                  final int row,
                                  final int column,
                                  final int maxRow,
                                  final int maxColumn,
                                  final int offsetColumn)
            throws IllegalArgumentException {

        if ((matrixY.getRows() != matrixX.getRows()) || (matrixY.getColumns() != matrixX.getColumns())) {
            throw new IllegalArgumentException("kernel dimensions differ, matrixY is " +
                                               matrixY.getRows() + "x" + matrixY.getColumns() +
                                               " but matrixX is " +
                                               matrixX.getRows() + "x" + matrixX.getColumns());
        }

        final ColorVector vectorY = new ColorVector();
        final ColorVector vectorX = new ColorVector();
        final ColorVector currentColor = new ColorVector();

        final int matrixHeight = matrixY.getRows();
        final int matrixWidth = matrixY.getColumns();
        final int radiusY = matrixHeight >> 1;
        final int radiusX = matrixWidth >> 1;
        final int sourceOffsetColumnBase = column + offsetColumn;

        for (int y = 0; y < matrixHeight; y++) {

            final int offsetY = clamp(row + y - radiusY, 0, maxRow);
            final PixelRow sourceRow = sourcePixels.getRow(offsetY);

            for (int x = 0; x < matrixWidth; x++) {
                final int offsetX = clamp(sourceOffsetColumnBase + x - radiusX, offsetColumn, maxColumn);
                sourceRow.getColor(offsetX, currentColor);
                ColorVectorUtils.premultiply(currentColor);

                vectorX.addWeighted(matrixX.get(y, x), currentColor);
                vectorY.addWeighted(matrixY.get(y, x), currentColor);
            }
        }

        final ColorVector vector = new ColorVector().setMagnitude(vectorX, vectorY);
        storeWithTargetAlpha(vector, targetRow, column);
    }

    public static int clamp(final int value,
                            final int min,
                            final int max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }

    private static void storeWithTargetAlpha(final ColorVector vector,
                                             final PixelRow targetRow,
                                             final int column) {
        final ColorVector target = targetRow.getColor(column, new ColorVector());
        vector.a = target.a;
        ColorVectorUtils.unPremultiply(vector);
        targetRow.setColor(column, vector);
    }

    private Convolver() {
    }
}
