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
package edu.columbia.tjw.gprn.orbit;

import edu.columbia.tjw.gprn.InvalidParameterException;
import edu.columbia.tjw.gprn.MeanSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KeplerSolverTest
{
    private static final double TOLERANCE = 1.0e-10;
    private static final int MAX_ITER = 100;

    private static double[] generateMeanAnomaly()
    {
        final double[] output = new double[64];

        for (int i = 0; i < output.length; i++)
        {
            output[i] = -7.0 + 0.23 * i;
        }

        return output;
    }

    private static double maxResidual(final KeplerSolution solution_, final double[] meanAnomaly_, final double e_)
    {
        double max = 0.0;

        for (int i = 0; i < meanAnomaly_.length; i++)
        {
            final double anomaly = solution_.getEccentricAnomaly(i);
            final double residual = Math.abs(anomaly - e_ * Math.sin(anomaly) - meanAnomaly_[i]);
            max = Math.max(max, residual);
        }

        return max;
    }

    @Test
    void testMaxResidualConverges()
    {
        final KeplerSolver solver = new KeplerSolver(TOLERANCE, MAX_ITER, ConvergenceCheck.MAX_RESIDUAL);
        final double[] meanAnomaly = generateMeanAnomaly();

        for (final double e : new double[]
        {
            0.1, 0.5, 0.9
        })
        {
            final KeplerSolution solution = solver.solve(meanAnomaly, e);

            Assertions.assertTrue(solution.isConverged(), "e = " + e);
            Assertions.assertTrue(solution.getIterations() >= 1);
            Assertions.assertTrue(solution.getMaxResidual() <= TOLERANCE);
            Assertions.assertTrue(maxResidual(solution, meanAnomaly, e) <= 1.0e-9);
        }
    }

    @Test
    void testSinglePassStopsAfterOneRefinement()
    {
        final double[] meanAnomaly = generateMeanAnomaly();
        final double e = 0.9;

        final KeplerSolver single = new KeplerSolver(TOLERANCE, MAX_ITER, ConvergenceCheck.SINGLE_PASS);
        final KeplerSolver full = new KeplerSolver(TOLERANCE, MAX_ITER, ConvergenceCheck.MAX_RESIDUAL);

        final KeplerSolution singleResult = single.solve(meanAnomaly, e);
        final KeplerSolution fullResult = full.solve(meanAnomaly, e);

        Assertions.assertEquals(1, singleResult.getIterations());
        Assertions.assertTrue(fullResult.getMaxResidual() <= singleResult.getMaxResidual());
        Assertions.assertEquals(singleResult.getMaxResidual(), maxResidual(singleResult, meanAnomaly, e), 1.0e-12);
    }

    @Test
    void testSinglePassMatchesManualStep()
    {
        final double m = 1.3;
        final double e = 0.4;

        double anomaly = m + e * Math.sin(m) + 0.5 * e * e * Math.sin(2.0 * m);
        final double residual = anomaly - e * Math.sin(anomaly) - m;
        final double m1p = 1.0 - e * Math.cos(anomaly);
        final double m1pp = e * Math.sin(anomaly);
        final double m1ppp = 1.0 - m1p;
        final double d1 = -residual / m1p;
        final double d2 = -residual / (m1p + d1 * m1pp / 2.0);
        final double d3 = -residual / (m1p + d2 * m1pp / 2.0 + d2 * d2 * m1ppp / 6.0);
        anomaly += d3;

        final KeplerSolver solver = new KeplerSolver(MeanSettings.getDefault());
        final KeplerSolution solution = solver.solve(new double[]
        {
            m
        }, e);

        Assertions.assertEquals(ConvergenceCheck.SINGLE_PASS, solver.getConvergenceCheck());
        Assertions.assertEquals(anomaly, solution.getEccentricAnomaly(0), 1.0e-14);
    }

    @Test
    void testIterationCap()
    {
        final KeplerSolver solver = new KeplerSolver(1.0e-12, 1, ConvergenceCheck.MAX_RESIDUAL);
        final double[] meanAnomaly = new double[]
        {
            0.05, 0.1, 0.2
        };

        final KeplerSolution solution = solver.solve(meanAnomaly, 0.95);

        Assertions.assertEquals(1, solution.getIterations());
        Assertions.assertFalse(solution.isConverged());
        Assertions.assertTrue(solution.getMaxResidual() > 1.0e-12);
    }

    @Test
    void testUndefinedAnomalyIsNotConverged()
    {
        final double[] meanAnomaly = new double[]
        {
            Double.NaN, 1.0
        };

        for (final ConvergenceCheck check : ConvergenceCheck.values())
        {
            final KeplerSolution solution = new KeplerSolver(TOLERANCE, MAX_ITER, check).solve(meanAnomaly, 0.5);

            Assertions.assertFalse(solution.isConverged(), check.toString());
            Assertions.assertTrue(Double.isNaN(solution.getMaxResidual()));
            Assertions.assertTrue(Double.isNaN(solution.getEccentricAnomaly(0)));
        }
    }

    @Test
    void testCircular()
    {
        final double[] meanAnomaly = generateMeanAnomaly();
        final KeplerSolution solution = new KeplerSolver(MeanSettings.getDefault()).solve(meanAnomaly, 0.0);

        Assertions.assertEquals(0, solution.getIterations());
        Assertions.assertTrue(solution.isConverged());
        Assertions.assertArrayEquals(meanAnomaly, solution.getEccentricAnomaly());
    }

    @Test
    void testTrueAnomaly()
    {
        Assertions.assertEquals(0.0, KeplerSolver.trueAnomaly(0.0, 0.7), 1.0e-15);
        Assertions.assertEquals(1.0, KeplerSolver.trueAnomaly(1.0, 0.0), 1.0e-14);

        //Past the semi-minor axis the true anomaly leads the eccentric one.
        Assertions.assertTrue(KeplerSolver.trueAnomaly(1.0, 0.5) > 1.0);
    }

    @Test
    void testRejectsBadArguments()
    {
        final KeplerSolver solver = new KeplerSolver(MeanSettings.getDefault());
        Assertions.assertThrows(InvalidParameterException.class, () -> solver.solve(new double[1], 1.0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new KeplerSolver(0.0, 10, ConvergenceCheck.SINGLE_PASS));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new KeplerSolver(1.0e-10, 0, ConvergenceCheck.SINGLE_PASS));
    }
}
