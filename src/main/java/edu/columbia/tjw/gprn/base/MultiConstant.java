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
package edu.columbia.tjw.gprn.base;

import edu.columbia.tjw.gprn.InvalidParameterException;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.ParameterCountException;
import edu.columbia.tjw.gprn.ShapeException;
import edu.columbia.tjw.gprn.util.LogUtil;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Constant mean for a time series stitched together from several instruments.
 *
 * Parameters are [off_1, off_2, ..., off_{n-1}, mean]: the offset of each
 * instrument relative to the last one, followed by the absolute level of the
 * last instrument. Instrument labels are one-based and must form contiguous,
 * non-decreasing blocks, e.g. [1, 1, 1, 2, 2, 3].
 *
 * @author tyler
 */
public final class MultiConstant extends AbstractMeanFunction
{
    private static final Logger LOG = LogUtil.getLogger(MultiConstant.class);

    private final int[] _obsid;
    private final double[] _time;

    //Zero based instrument index of each observation.
    private final int[] _instrument;
    private final double[] _timeBins;

    /**
     * @param offsets_ Starting values, [off_1, ..., off_{n-1}, mean]
     * @param obsid_ Instrument label of each observation, copied
     * @param time_ Time of each observation, copied
     */
    public MultiConstant(final double[] offsets_, final int[] obsid_, final double[] time_)
    {
        super(MeanFunctionType.MULTI_CONSTANT, generateNames(checkContext(obsid_, time_), offsets_.length),
                offsets_);

        _obsid = obsid_.clone();
        _time = time_.clone();
        _instrument = new int[_obsid.length];

        for (int i = 0; i < _obsid.length; i++)
        {
            _instrument[i] = _obsid[i] - 1;
        }

        _timeBins = computeTimeBins(_obsid, _time);

        if (LOG.isLoggable(Level.FINE))
        {
            LOG.fine("Instrument time bins: " + LogUtil.abbreviate(_timeBins, 10));
        }
    }

    public MultiConstant(final double offset_, final int[] obsid_, final double[] time_)
    {
        this(new double[]
        {
            offset_
        }, obsid_, time_);
    }

    /**
     * All offsets and the mean set to zero.
     *
     * @param obsid_ Instrument label of each observation
     * @param time_ Time of each observation
     * @return A new zero MultiConstant
     */
    public static MultiConstant initialize(final int[] obsid_, final double[] time_)
    {
        final int count = countParams(checkContext(obsid_, time_));
        return new MultiConstant(new double[count], obsid_, time_);
    }

    /**
     * One parameter per step between consecutive instruments, plus the mean.
     *
     * @param obsid_ Instrument labels
     * @return The number of parameters implied by the labels
     */
    public static int countParams(final int[] obsid_)
    {
        int count = 1;

        for (int i = 1; i < obsid_.length; i++)
        {
            if (obsid_[i] - obsid_[i - 1] == 1)
            {
                count++;
            }
        }

        return count;
    }

    private static int[] checkContext(final int[] obsid_, final double[] time_)
    {
        if (null == obsid_ || null == time_)
        {
            throw new ShapeException("Instrument labels and times must not be null.");
        }
        if (obsid_.length != time_.length)
        {
            throw new ShapeException("MultiConstant context", obsid_.length, time_.length);
        }
        if (obsid_.length < 1)
        {
            throw new ShapeException("MultiConstant needs at least one observation.");
        }
        if (obsid_[0] != 1)
        {
            throw new InvalidParameterException("Instrument labels must start at 1: " + obsid_[0]);
        }

        for (int i = 1; i < obsid_.length; i++)
        {
            final int step = obsid_[i] - obsid_[i - 1];

            if (step != 0 && step != 1)
            {
                throw new InvalidParameterException("Instrument labels must form contiguous blocks, found "
                        + obsid_[i - 1] + " followed by " + obsid_[i] + " at " + i);
            }
        }

        return obsid_;
    }

    private static List<String> generateNames(final int[] obsid_, final int supplied_)
    {
        final int count = countParams(obsid_);

        if (supplied_ != count)
        {
            throw new ParameterCountException(MultiConstant.class.getSimpleName(), count, supplied_);
        }

        final List<String> names = new ArrayList<>(count);

        for (int i = 1; i < count; i++)
        {
            names.add("off" + i);
        }

        names.add("mean");
        return names;
    }

    private static double[] computeTimeBins(final int[] obsid_, final double[] time_)
    {
        final List<Double> edges = new ArrayList<>();
        edges.add(time_[0]);

        for (int i = 1; i < obsid_.length; i++)
        {
            if (obsid_[i] != obsid_[i - 1])
            {
                edges.add(0.5 * (time_[i - 1] + time_[i]));
            }
        }

        final double[] output = new double[edges.size()];

        for (int i = 0; i < output.length; i++)
        {
            output[i] = edges.get(i);
        }

        Arrays.sort(output);
        return output;
    }

    /**
     * Bin edges between instruments: the first observation time, followed by
     * the midpoint between the last time of each instrument and the first time
     * of the next.
     *
     * @return A new ascending array, one edge per instrument
     */
    public double[] timeBins()
    {
        return _timeBins.clone();
    }

    public int[] getObsid()
    {
        return _obsid.clone();
    }

    public double[] getTime()
    {
        return _time.clone();
    }

    public int getInstrumentCount()
    {
        return _timeBins.length;
    }

    /**
     * Evaluates this function. A vector as long as the observation times is
     * taken to be those observations and uses their recorded instruments.
     * Anything else is assigned to instruments through timeBins(), with times
     * before the first observation falling to the last instrument.
     *
     * @param times_ The times of interest, not modified
     * @return The level of the instrument covering each time
     */
    @Override
    public double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);

        if (times.length == _time.length)
        {
            return evaluateIndices(_instrument);
        }

        final int last = getParamCount() - 1;
        final int[] indices = new int[times.length];

        for (int i = 0; i < times.length; i++)
        {
            final int bin = MathFunctions.upperBound(_timeBins, times[i]) - 1;
            indices[i] = (bin < 0) ? last : bin;
        }

        return evaluateIndices(indices);
    }

    /**
     * Evaluates at the observation times, with the instrument recorded for
     * each observation.
     *
     * @param times_ The observation times
     * @return The level of each observation's instrument
     * @throws ShapeException If times_ is not as long as the observations
     */
    public double[] evaluateObserved(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);

        if (times.length != _time.length)
        {
            throw new ShapeException("MultiConstant observations", _time.length, times.length);
        }

        return evaluateIndices(_instrument);
    }

    private double[] evaluateIndices(final int[] indices_)
    {
        final double[] params = params();
        final int last = params.length - 1;
        final double mean = params[last];
        final double[] output = new double[indices_.length];

        for (int i = 0; i < indices_.length; i++)
        {
            final int index = indices_[i];

            //The last instrument is the reference, it has no offset of its own.
            final double offset = (index == last) ? 0.0 : params[index];
            output[i] = mean + offset;
        }

        return output;
    }
}
