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

import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.Arrays;
import org.apache.commons.math3.util.FastMath;

/**
 * A sinusoid, m(t) = amplitude * sin(2 pi t / period + phase).
 *
 * @author tyler
 */
public final class Sine extends AbstractMeanFunction
{
    public Sine(final double amplitude_, final double period_, final double phase_)
    {
        super(MeanFunctionType.SINE, Arrays.asList("amplitude", "period", "phase"), new double[]
        {
            amplitude_, period_, phase_
        });
    }

    public static Sine initialize()
    {
        return new Sine(0.0, 0.0, 0.0);
    }

    @Override
    public double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] params = params();
        final double amplitude = params[0];
        final double period = params[1];
        final double phase = params[2];

        final double[] output = new double[times.length];

        for (int i = 0; i < times.length; i++)
        {
            output[i] = amplitude * FastMath.sin((MathFunctions.TWO_PI * times[i] / period) + phase);
        }

        return output;
    }
}
