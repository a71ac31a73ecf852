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
package edu.columbia.tjw.gprn;

import edu.columbia.tjw.gprn.composite.Product;
import edu.columbia.tjw.gprn.composite.Sum;
import edu.columbia.tjw.gprn.util.LogUtil;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composition of mean functions, and handling of one flat parameter vector
 * shared by several independent mean functions.
 *
 * @author tyler
 */
public final class MeanFunctions
{
    private static final Logger LOG = LogUtil.getLogger(MeanFunctions.class);

    private MeanFunctions()
    {
    }

    public static MeanFunction sumOf(final MeanFunction a_, final MeanFunction b_)
    {
        return new Sum(a_, b_);
    }

    public static MeanFunction productOf(final MeanFunction a_, final MeanFunction b_)
    {
        return new Product(a_, b_);
    }

    /**
     * Sums the functions left to right, so [a, b, c] becomes (a + b) + c.
     *
     * @param functions_ At least one mean function
     * @return The sum, or the only element if there is just one
     */
    public static MeanFunction sumOf(final List<? extends MeanFunction> functions_)
    {
        if (functions_.isEmpty())
        {
            throw new IllegalArgumentException("Cannot sum an empty list of mean functions.");
        }

        MeanFunction output = functions_.get(0);

        for (int i = 1; i < functions_.size(); i++)
        {
            output = sumOf(output, functions_.get(i));
        }

        return output;
    }

    public static int getParamCount(final List<? extends MeanFunction> functions_)
    {
        int count = 0;

        for (final MeanFunction next : functions_)
        {
            count += next.getParamCount();
        }

        return count;
    }

    /**
     * Concatenates the parameters of all functions, in list order.
     *
     * @param functions_ The functions to read
     * @return A new array of length getParamCount(functions_)
     */
    public static double[] getParameters(final List<? extends MeanFunction> functions_)
    {
        final double[] output = new double[getParamCount(functions_)];
        int pointer = 0;

        for (final MeanFunction next : functions_)
        {
            final double[] params = next.getParameters();
            System.arraycopy(params, 0, output, pointer, params.length);
            pointer += params.length;
        }

        return output;
    }

    /**
     * Hands successive slices of stream_ to each function in list order.
     *
     * The stream must cover every function. Functions before a failing one
     * keep their new values.
     *
     * @param functions_ The functions to update
     * @param stream_ The flat parameter vector
     * @return Whatever is left after the last function, possibly empty
     */
    public static double[] setParameters(final List<? extends MeanFunction> functions_, final double[] stream_)
    {
        double[] remainder = stream_;

        for (final MeanFunction next : functions_)
        {
            remainder = next.setParameters(remainder);
        }

        if (LOG.isLoggable(Level.FINE))
        {
            LOG.fine("Distributed " + (stream_.length - remainder.length) + " parameters over " + functions_.size()
                    + " mean functions, " + remainder.length + " left over.");
        }

        return remainder;
    }
}
