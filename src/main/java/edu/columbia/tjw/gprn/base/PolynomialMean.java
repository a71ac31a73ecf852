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
import java.util.List;

/**
 * A polynomial in t whose parameters are its coefficients, highest degree
 * first.
 *
 * @author tyler
 */
public abstract class PolynomialMean extends AbstractMeanFunction
{
    protected PolynomialMean(final MeanFunctionType type_, final List<String> paramNames_, final double[] coefficients_)
    {
        super(type_, paramNames_, coefficients_);
    }

    public final int getDegree()
    {
        return getParamCount() - 1;
    }

    @Override
    public final double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] coefficients = params();
        final double[] output = new double[times.length];

        for (int i = 0; i < times.length; i++)
        {
            output[i] = MathFunctions.polyval(coefficients, times[i]);
        }

        return output;
    }
}
