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
package org.janelia.pixel.kernel;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Immutable grid of float weights (typically a convolution kernel).
 * Values are stored row-major and are never exposed, so instances can be safely shared
 * between threads.
 *
 * @author Eric Trautman
 */
public class DenseMatrix
        implements Serializable {

    private final int rows;
    private final int columns;
    private final float[] data;

    /**
     * @param  rows     number of rows.
     * @param  columns  number of columns.
     * @param  data     row-major weights (copied).
     *
     * @throws IllegalArgumentException
     *   if the dimensions are not positive or do not match the data length.
     */
    public DenseMatrix(final int rows,
                       final int columns,
                       final float[] data)
            throws IllegalArgumentException {

        if ((rows < 1) || (columns < 1)) {
            throw new IllegalArgumentException("matrix dimensions must be positive but were " +
                                               rows + "x" + columns);
        }
        if (data == null) {
            throw new IllegalArgumentException("matrix data must be specified");
        }
        if (data.length != rows * columns) {
            throw new IllegalArgumentException("matrix data length " + data.length +
                                               " does not match dimensions " + rows + "x" + columns);
        }

        this.rows = rows;
        this.columns = columns;
        this.data = data.clone();
    }

    /**
     * @param  values  weights indexed as values[row][column] (copied).
     *
     * @throws IllegalArgumentException
     *   if the array is empty or ragged.
     */
    public DenseMatrix(final float[][] values)
            throws IllegalArgumentException {
        this(values == null ? 0 : values.length,
             (values == null) || (values.length == 0) ? 0 : values[0].length,
             flatten(values));
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @return the weight at the specified location.
     *
     * @throws IndexOutOfBoundsException
     *   if the location is outside this matrix.
     */
    public float get(final int row,
                     final int column)
            throws IndexOutOfBoundsException {
        if ((row < 0) || (row >= rows) || (column < 0) || (column >= columns)) {
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") is outside " +
                                                rows + "x" + columns + " matrix");
        }
        return data[(row * columns) + column];
    }

    /**
     * @return sum of all weights.
     */
    public float sum() {
        float sum = 0f;
        for (final float value : data) {
            sum += value;
        }
        return sum;
    }

    /**
     * @return new matrix with rows and columns swapped.
     */
    public DenseMatrix transpose() {
        final float[] transposed = new float[data.length];
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                transposed[(column * rows) + row] = data[(row * columns) + column];
            }
        }
        return new DenseMatrix(columns, rows, transposed);
    }

    /**
     * @return copy of this matrix's weights as values[row][column].
     */
    public float[][] toArray() {
        final float[][] values = new float[rows][];
        for (int row = 0; row < rows; row++) {
            values[row] = Arrays.copyOfRange(data, row * columns, (row + 1) * columns);
        }
        return values;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final DenseMatrix that = (DenseMatrix) o;
        return (rows == that.rows) && (columns == that.columns) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return (31 * ((31 * rows) + columns)) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "DenseMatrix{" + rows + "x" + columns + ", data=" + Arrays.toString(data) + '}';
    }

    private static float[] flatten(final float[][] values) {
        if ((values == null) || (values.length == 0)) {
            return new float[0];
        }
        final int columns = values[0].length;
        final float[] data = new float[values.length * columns];
        for (int row = 0; row < values.length; row++) {
            if (values[row].length != columns) {
                throw new IllegalArgumentException("row " + row + " has " + values[row].length +
                                                   " columns instead of " + columns);
            }
            System.arraycopy(values[row], 0, data, row * columns, columns);
        }
        return data;
    }

}
