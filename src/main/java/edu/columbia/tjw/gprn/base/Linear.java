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

/**
 * A linear trend, m(t) = slope * (t - mean(t)) + intercept.
 *
 * Times are centered on their own mean, so the intercept is the value at the
 * mean epoch of whatever vector is being evaluated.
 *
 * @author tyler
 */
public final class Linear extends AbstractMeanFunction
{
    public Linear(final double slope_, final double intercept_)
    {
        super(MeanFunctionType.LINEAR, Arrays.asList("slope", "intercept"), new double[]
        {
            slope_, intercept_
        });
    }

    public static Linear initialize()
    {
        return new Linear(0.0, 0.0);
    }

    @Override
    public double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] params = params();
        final double slope = params[0];
        final double intercept = params[1];
        final double center = MathFunctions.mean(times);

        final double[] output = new double[times.length];

        for (int i = 0; i < times.length; i++)
        {
            output[i] = slope * (times[i] - center) + intercept;
        }

        return output;
    }
}
