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
package org.janelia.pixel.parallel;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a rectangle into disjoint row chunks that together cover all of its rows
 * and runs a computation for each chunk.
 *
 * The number of chunks is chosen so that each one covers at least
 * {@link ParallelExecutionSettings#getMinimumPixelsPerTask()} pixels (where possible)
 * and no more than {@link ParallelExecutionSettings#getMaxDegreeOfParallelism()} chunks are created.
 * Because chunks never overlap, bodies that only write rows within their own chunk
 * need no synchronization.
 *
 * @author Eric Trautman
 */
public class ParallelRowIterator {

    /**
     * @return the row chunks for the specified rectangle (in top to bottom order).
     */
    public static List<RowInterval> partitionRows(final Rectangle rectangle,
                                                  final ParallelExecutionSettings settings) {

        final List<RowInterval> intervals = new ArrayList<>();

        final int top = rectangle.y;
        final int bottom = rectangle.y + rectangle.height;
        final int height = rectangle.height;
        if ((height < 1) || (rectangle.width < 1)) {
            return intervals;
        }

        final long pixelCount = (long) rectangle.width * height;
        final long maxSteps = divideCeil(pixelCount, settings.getMinimumPixelsPerTask());
        final int numberOfSteps = (int) Math.min(Math.min(settings.getMaxDegreeOfParallelism(), maxSteps), height);

        if (numberOfSteps <= 1) {
            intervals.add(new RowInterval(top, bottom));
        } else {
            final int verticalStep = (int) divideCeil(height, numberOfSteps);
            for (int i = 0; i < numberOfSteps; i++) {
                final int yMin = top + (i * verticalStep);
                if (yMin >= bottom) {
                    break;
                }
                final int yMax = Math.min(yMin + verticalStep, bottom);
                intervals.add(new RowInterval(yMin, yMax));
            }
        }

        return intervals;
    }

    /**
     * Runs the body for every row chunk of the rectangle.
     * A single chunk is processed on the calling thread, multiple chunks are submitted to the
     * settings' executor service and this method returns once all of them have completed.
     *
     * @throws PixelProcessingException
     *   if a chunk fails with a checked exception or the calling thread is interrupted.
     *   Unchecked chunk failures are rethrown as is.
     */
    public static void iterateRows(final Rectangle rectangle,
                                   final ParallelExecutionSettings settings,
                                   final Consumer<RowInterval> body)
            throws PixelProcessingException {

        final List<RowInterval> intervals = partitionRows(rectangle, settings);

        if (intervals.size() == 1) {
            body.accept(intervals.get(0));
            return;
        }

        LOG.debug("iterateRows: processing {} chunks for {} with settings {}",
                  intervals.size(), rectangle, settings);

        final List<Callable<RowInterval>> tasks = new ArrayList<>(intervals.size());
        for (final RowInterval interval : intervals) {
            tasks.add(() -> {
                body.accept(interval);
                return interval;
            });
        }

        try {
            final List<Future<RowInterval>> results = settings.getExecutorService().invokeAll(tasks);
            for (final Future<RowInterval> result : results) {
                result.get();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PixelProcessingException("interrupted while processing rows of " + rectangle, e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new PixelProcessingException("failed to process rows of " + rectangle, cause);
        }
    }

    private static long divideCeil(final long dividend,
                                   final long divisor) {
        return ((dividend - 1) / divisor) + 1;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ParallelRowIterator.class);
}
