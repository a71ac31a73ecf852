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
import java.util.Collections;

/**
 * A constant offset, m(t) = c.
 *
 * @author tyler
 */
public final class Constant extends AbstractMeanFunction
{
    public Constant(final double c_)
    {
        super(MeanFunctionType.CONSTANT, Collections.singletonList("c"), new double[]
        {
            c_
        });
    }

    public static Constant initialize()
    {
        return new Constant(0.0);
    }

    @Override
    public double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] output = new double[times.length];
        Arrays.fill(output, getParam(0));
        return output;
    }
}
