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

import edu.columbia.tjw.gprn.base.Constant;
import edu.columbia.tjw.gprn.base.Cubic;
import edu.columbia.tjw.gprn.base.Linear;
import edu.columbia.tjw.gprn.base.Sine;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MeanFunctionsTest
{

    @Test
    void testSharedFlatVector()
    {
        final List<MeanFunction> means = Arrays.asList(Constant.initialize(), Linear.initialize().plus(
                Sine.initialize()), Cubic.initialize());

        Assertions.assertEquals(10, MeanFunctions.getParamCount(means));

        final double[] global = new double[]
        {
            0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11
        };
        final double[] remainder = MeanFunctions.setParameters(means, global);

        Assertions.assertArrayEquals(new double[]
        {
            10, 11
        }, remainder);
        Assertions.assertArrayEquals(new double[]
        {
            1, 2, 3, 4, 5
        }, means.get(1).getParameters());
        Assertions.assertArrayEquals(Arrays.copyOf(global, 10), MeanFunctions.getParameters(means));
    }

    @Test
    void testSharedVectorTooShort()
    {
        final List<MeanFunction> means = Arrays.asList(Constant.initialize(), Linear.initialize());
        Assertions.assertThrows(ParameterCountException.class, () -> MeanFunctions.setParameters(means, new double[]
        {
            1.0, 2.0
        }));
    }

    @Test
    void testSumOfList()
    {
        final MeanFunction sum = MeanFunctions.sumOf(Arrays.asList(new Constant(1.0), new Constant(2.0),
                new Constant(3.0)));

        Assertions.assertEquals("Constant(1.0) + Constant(2.0) + Constant(3.0)", sum.toString());
        Assertions.assertEquals(6.0, sum.evaluate(0.0)[0]);

        final MeanFunction single = new Linear(1.0, 0.0);
        Assertions.assertSame(single, MeanFunctions.sumOf(Collections.singletonList(single)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeanFunctions.sumOf(Collections.<MeanFunction>emptyList()));
    }
}
