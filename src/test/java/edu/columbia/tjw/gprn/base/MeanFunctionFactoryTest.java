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

import edu.columbia.tjw.gprn.MeanFunction;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.MeanSettings;
import edu.columbia.tjw.gprn.ParameterCountException;
import edu.columbia.tjw.gprn.orbit.ConvergenceCheck;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MeanFunctionFactoryTest
{
    private final MeanFunctionFactory _factory = new MeanFunctionFactory();

    @Test
    void testGenerateAtOffset()
    {
        final double[] params = new double[]
        {
            -1.0, 10.0, 2.0, 0.25, 0.5, 0.1, 3.0, 99.0
        };

        final MeanFunction kep = _factory.generate(MeanFunctionType.KEPLERIAN, 1, params);
        Assertions.assertTrue(kep instanceof Keplerian);
        Assertions.assertArrayEquals(new double[]
        {
            10.0, 2.0, 0.25, 0.5, 0.1, 3.0
        }, kep.getParameters());

        final MeanFunction sine = _factory.generate(MeanFunctionType.SINE, 5, params);
        Assertions.assertEquals("Sine(0.1, 3.0, 99.0)", sine.toString());
    }

    @Test
    void testInitializeEveryFixedType()
    {
        for (final MeanFunctionType type : MeanFunctionType.values())
        {
            if (!type.hasFixedParamCount())
            {
                Assertions.assertThrows(IllegalArgumentException.class, () -> _factory.initialize(type));
                continue;
            }

            final MeanFunction mean = _factory.initialize(type);
            Assertions.assertEquals(type, mean.getType());
            Assertions.assertEquals(type.getParamCount(), mean.getParamCount());
            Assertions.assertArrayEquals(new double[type.getParamCount()], mean.getParameters());
        }
    }

    @Test
    void testShortArray()
    {
        Assertions.assertThrows(ParameterCountException.class, () -> _factory.generate(MeanFunctionType.CUBIC, 2,
                new double[5]));
        Assertions.assertThrows(IllegalArgumentException.class, () -> _factory.generate(MeanFunctionType.SUM, 0,
                new double[5]));
    }

    @Test
    void testSettingsReachKeplerian()
    {
        final MeanSettings settings = MeanSettings.getDefault().makeBuilder()
                .setConvergenceCheck(ConvergenceCheck.MAX_RESIDUAL).build();
        final Keplerian kep = (Keplerian) new MeanFunctionFactory(settings).initialize(MeanFunctionType.KEPLERIAN);

        Assertions.assertEquals(ConvergenceCheck.MAX_RESIDUAL, kep.getSolver().getConvergenceCheck());
        Assertions.assertThrows(IllegalStateException.class, () -> MeanFunctionType.MULTI_CONSTANT.getParamCount());
        Assertions.assertTrue(MeanFunctionType.PRODUCT.isComposite());
    }
}
