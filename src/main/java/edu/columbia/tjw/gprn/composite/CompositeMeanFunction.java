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
package edu.columbia.tjw.gprn.composite;

import edu.columbia.tjw.gprn.MeanFunction;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.ShapeException;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A binary node combining two mean functions elementwise.
 *
 * Holds no parameters of its own. Its parameter vector is the left child's
 * followed by the right child's, read from the children on every call.
 *
 * @author tyler
 */
public abstract class CompositeMeanFunction implements MeanFunction
{
    private final MeanFunctionType _type;
    private final MeanFunction _left;
    private final MeanFunction _right;

    protected CompositeMeanFunction(final MeanFunctionType type_, final MeanFunction left_, final MeanFunction right_)
    {
        if (null == left_ || null == right_)
        {
            throw new NullPointerException("Children cannot be null.");
        }

        _type = type_;
        _left = left_;
        _right = right_;
    }

    /**
     * Combines one pair of child values.
     *
     * @param left_ The left child's value
     * @param right_ The right child's value
     * @return The value of this node
     */
    protected abstract double combine(final double left_, final double right_);

    /**
     * The symbol joining the two children in toString().
     *
     * @return The operator symbol
     */
    protected abstract String getOperator();

    public final MeanFunction getLeft()
    {
        return _left;
    }

    public final MeanFunction getRight()
    {
        return _right;
    }

    @Override
    public final double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] left = _left.evaluate(times);
        final double[] right = _right.evaluate(times);

        if (left.length != times.length || right.length != times.length)
        {
            throw new ShapeException("Composite children returned " + left.length + " and " + right.length
                    + " values for " + times.length + " times.");
        }

        final double[] output = new double[times.length];

        for (int i = 0; i < output.length; i++)
        {
            output[i] = combine(left[i], right[i]);
        }

        return output;
    }

    @Override
    public final double[] getParameters()
    {
        final double[] left = _left.getParameters();
        final double[] right = _right.getParameters();
        final double[] output = new double[left.length + right.length];
        System.arraycopy(left, 0, output, 0, left.length);
        System.arraycopy(right, 0, output, left.length, right.length);
        return output;
    }

    @Override
    public final double[] setParameters(final double[] stream_)
    {
        final double[] previous = _left.getParameters();
        final double[] remainder = _left.setParameters(stream_);

        try
        {
            return _right.setParameters(remainder);
        }
        catch (final RuntimeException e)
        {
            //Put the left side back so a failed update leaves this node as it was.
            try
            {
                _left.setParameters(previous);
            }
            catch (final RuntimeException restoreFailure)
            {
                //Placeholders (e.g. a zero Keplerian) cannot be set back through validation.
                e.addSuppressed(restoreFailure);
            }

            throw e;
        }
    }

    @Override
    public final int getParamCount()
    {
        return _left.getParamCount() + _right.getParamCount();
    }

    @Override
    public final List<String> getParamNames()
    {
        final List<String> names = new ArrayList<>(getParamCount());
        names.addAll(_left.getParamNames());
        names.addAll(_right.getParamNames());
        return Collections.unmodifiableList(names);
    }

    @Override
    public final MeanFunctionType getType()
    {
        return _type;
    }

    @Override
    public final String toString()
    {
        return _left + " " + getOperator() + " " + _right;
    }
}
