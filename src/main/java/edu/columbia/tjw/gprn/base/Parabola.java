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
import java.util.Arrays;

/**
 * m(t) = quad * t^2 + slope * t + intercept
 *
 * @author tyler
 */
public final class Parabola extends PolynomialMean
{
    public Parabola(final double quad_, final double slope_, final double intercept_)
    {
        super(MeanFunctionType.PARABOLA, Arrays.asList("quadratic", "slope", "intercept"), new double[]
        {
            quad_, slope_, intercept_
        });
    }

    public static Parabola initialize()
    {
        return new Parabola(0.0, 0.0, 0.0);
    }
}
