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

/**
 * The eccentric anomalies produced by a KeplerSolver, with the state of the
 * iteration that produced them.
 *
 * @author tyler
 */
public final class KeplerSolution
{
    private final double[] _eccentricAnomaly;
    private final int _iterations;
    private final double _maxResidual;
    private final boolean _converged;

    public KeplerSolution(final double[] eccentricAnomaly_, final int iterations_, final double maxResidual_,
            final boolean converged_)
    {
        _eccentricAnomaly = eccentricAnomaly_;
        _iterations = iterations_;
        _maxResidual = maxResidual_;
        _converged = converged_;
    }

    public double[] getEccentricAnomaly()
    {
        return _eccentricAnomaly.clone();
    }

    public double getEccentricAnomaly(final int index_)
    {
        return _eccentricAnomaly[index_];
    }

    public int size()
    {
        return _eccentricAnomaly.length;
    }

    /**
     * Number of refinement passes applied after the series starting guess.
     *
     * @return The pass count, zero if the starting guess was already good
     */
    public int getIterations()
    {
        return _iterations;
    }

    /**
     * Largest |E - e sin(E) - M| over all elements, measured against the
     * original mean anomaly.
     *
     * @return The final residual
     */
    public double getMaxResidual()
    {
        return _maxResidual;
    }

    public boolean isConverged()
    {
        return _converged;
    }

    @Override
    public String toString()
    {
        return "KeplerSolution[" + _eccentricAnomaly.length + ", " + _iterations + ", " + _maxResidual + ", "
                + _converged + "]";
    }
}
