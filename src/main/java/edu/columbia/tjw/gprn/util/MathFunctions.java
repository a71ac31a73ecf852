/*
 * Copyright 2014 Tyler Ward.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.columbia.tjw.gprn.util;

import edu.columbia.tjw.gprn.ShapeException;

/**
 * Vector helpers shared by the mean functions.
 *
 * @author tyler
 */
public final class MathFunctions
{
    public static final double TWO_PI = 2.0 * Math.PI;

    private MathFunctions()
    {
    }

    /**
     * Validates a time vector before evaluation. Inputs are never copied or
     * modified, callers must not write into the returned array.
     *
     * @param times_ The times to be evaluated
     * @return times_, once checked
     */
    public static double[] checkTimes(final double[] times_)
    {
        if (null == times_)
        {
            throw new ShapeException("Times must not be null.");
        }

        return times_;
    }

    public static double mean(final double[] values_)
    {
        if (values_.length < 1)
        {
            return Double.NaN;
        }

        double sum = 0.0;

        for (int i = 0; i < values_.length; i++)
        {
            sum += values_[i];
        }

        final double output = sum / values_.length;
        return output;
    }

    /**
     * Evaluates the polynomial with the given coefficients at x_, using
     * Horner's scheme.
     *
     * @param coefficients_ Coefficients, highest degree first
     * @param x_ The point of evaluation
     * @return p(x)
     */
    public static double polyval(final double[] coefficients_, final double x_)
    {
        double result = 0.0;

        for (int i = 0; i < coefficients_.length; i++)
        {
            result = (result * x_) + coefficients_[i];
        }

        return result;
    }

    /**
     * Largest absolute value in the array, or NaN if any element is NaN.
     *
     * @param values_ The values to scan
     * @return max |values_[i]|, zero for an empty array
     */
    public static double maxAbs(final double[] values_)
    {
        double max = 0.0;

        for (int i = 0; i < values_.length; i++)
        {
            //NaN must win, otherwise a diverged solve looks converged.
            if (Double.isNaN(values_[i]))
            {
                return Double.NaN;
            }

            final double abs = Math.abs(values_[i]);

            if (abs > max)
            {
                max = abs;
            }
        }

        return max;
    }

    /**
     * Index of the first element of the sorted array that is strictly greater
     * than x_, i.e. the number of elements less than or equal to x_.
     *
     * @param sorted_ An ascending array
     * @param x_ The value to locate
     * @return The insertion point to the right of any equal elements
     */
    public static int upperBound(final double[] sorted_, final double x_)
    {
        int low = 0;
        int high = sorted_.length;

        while (low < high)
        {
            final int mid = (low + high) >>> 1;

            if (sorted_[mid] <= x_)
            {
                low = mid + 1;
            }
            else
            {
                high = mid;
            }
        }

        return low;
    }

    public static boolean isWellDefined(final double value_)
    {
        return !(Double.isNaN(value_) || Double.isInfinite(value_));
    }

}
