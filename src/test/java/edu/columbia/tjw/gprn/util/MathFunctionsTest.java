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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathFunctionsTest
{

    @Test
    void testUpperBound()
    {
        final double[] edges = new double[]
        {
            0.0, 1.5, 7.0
        };

        Assertions.assertEquals(0, MathFunctions.upperBound(edges, -1.0));
        Assertions.assertEquals(1, MathFunctions.upperBound(edges, 0.0));
        Assertions.assertEquals(2, MathFunctions.upperBound(edges, 1.5));
        Assertions.assertEquals(2, MathFunctions.upperBound(edges, 6.99));
        Assertions.assertEquals(3, MathFunctions.upperBound(edges, 7.0));
        Assertions.assertEquals(0, MathFunctions.upperBound(new double[0], 3.0));
    }

    @Test
    void testPolyval()
    {
        Assertions.assertEquals(11.0, MathFunctions.polyval(new double[]
        {
            1.0, 2.0, 3.0
        }, 2.0));
        Assertions.assertEquals(0.0, MathFunctions.polyval(new double[0], 2.0));
    }

    @Test
    void testMaxAbs()
    {
        Assertions.assertEquals(3.0, MathFunctions.maxAbs(new double[]
        {
            1.0, -3.0, 2.0
        }));
        Assertions.assertTrue(Double.isNaN(MathFunctions.maxAbs(new double[]
        {
            1.0, Double.NaN, 2.0
        })));
        Assertions.assertTrue(Double.isNaN(MathFunctions.maxAbs(new double[]
        {
            Double.NaN, 5.0
        })));
        Assertions.assertEquals(0.0, MathFunctions.maxAbs(new double[0]));
    }

    @Test
    void testAbbreviate()
    {
        Assertions.assertEquals("[1.0, 2.0, ... (3 total)]", LogUtil.abbreviate(new double[]
        {
            1.0, 2.0, 3.0
        }, 2));
        Assertions.assertEquals("[1.0]", LogUtil.abbreviate(new double[]
        {
            1.0
        }, 5));
    }
}
