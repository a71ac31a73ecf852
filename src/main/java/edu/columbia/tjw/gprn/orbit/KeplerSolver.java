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
import edu.columbia.tjw.gprn.util.LogUtil;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.util.FastMath;

/**
 * Solves Kepler's equation M = E - e sin(E) for the eccentric anomaly E of
 * elliptical orbits, over a whole vector of mean anomalies at once.
 *
 * Starts from the second order series E0 = M + e sin(M) + e^2 sin(2M) / 2 and
 * applies a third order correction to every element on each pass.
 *
 * @author tyler
 */
public final class KeplerSolver
{
    private static final Logger LOG = LogUtil.getLogger(KeplerSolver.class);

    private final double _tolerance;
    private final int _maxIterations;
    private final ConvergenceCheck _check;

    public KeplerSolver(final MeanSettings settings_)
    {
        this(settings_.getKeplerTolerance(), settings_.getKeplerMaxIterations(), settings_.getConvergenceCheck());
    }

    public KeplerSolver(final double tolerance_, final int maxIterations_, final ConvergenceCheck check_)
    {
        if (!(tolerance_ > 0.0))
        {
            throw new IllegalArgumentException("Tolerance must be positive: " + tolerance_);
        }
        if (maxIterations_ < 1)
        {
            throw new IllegalArgumentException("Iteration cap must be positive: " + maxIterations_);
        }
        if (null == check_)
        {
            throw new NullPointerException("Convergence check cannot be null.");
        }

        _tolerance = tolerance_;
        _maxIterations = maxIterations_;
        _check = check_;
    }

    public double getTolerance()
    {
        return _tolerance;
    }

    public int getMaxIterations()
    {
        return _maxIterations;
    }

    public ConvergenceCheck getConvergenceCheck()
    {
        return _check;
    }

    /**
     * Computes the eccentric anomaly for each mean anomaly.
     *
     * @param meanAnomaly_ Mean anomalies in radians, not modified
     * @param eccentricity_ Eccentricity, in [0, 1)
     * @return The solution, which may be unconverged if the cap was reached
     */
    public KeplerSolution solve(final double[] meanAnomaly_, final double eccentricity_)
    {
        if (!(eccentricity_ >= 0.0 && eccentricity_ < 1.0))
        {
            throw new InvalidParameterException("Eccentricity must be in [0, 1): " + eccentricity_);
        }

        final int size = meanAnomaly_.length;
        final double e = eccentricity_;
        final double[] anomaly = new double[size];
        final double[] residual = new double[size];

        for (int i = 0; i < size; i++)
        {
            final double m = meanAnomaly_[i];
            anomaly[i] = m + e * FastMath.sin(m) + 0.5 * (e * e) * FastMath.sin(2.0 * m);
        }

        double maxResidual = computeResiduals(anomaly, meanAnomaly_, e, residual);
        int count = 0;

        while (maxResidual > _tolerance && count < _maxIterations)
        {
            count++;

            for (int i = 0; i < size; i++)
            {
                anomaly[i] += halleyStep(anomaly[i], residual[i], e);
            }

            maxResidual = computeResiduals(anomaly, meanAnomaly_, e, residual);

            if (_check == ConvergenceCheck.SINGLE_PASS)
            {
                break;
            }
        }

        //A NaN residual never counts as converged.
        final boolean converged = maxResidual <= _tolerance;

        if (!converged && (_check == ConvergenceCheck.MAX_RESIDUAL || Double.isNaN(maxResidual)))
        {
            LOG.warning("Kepler solve did not converge after " + count + " iterations, residual " + maxResidual
                    + " (e = " + e + ")");
        }
        else if (LOG.isLoggable(Level.FINE))
        {
            LOG.fine("Kepler solve[" + _check + "]: " + count + " iterations, residual " + maxResidual);
        }

        return new KeplerSolution(anomaly, count, maxResidual, converged);
    }

    /**
     * One third order correction for a single element.
     *
     * @param anomaly_ The current eccentric anomaly
     * @param residual_ E - e sin(E) - M at anomaly_
     * @param e_ The eccentricity
     * @return The amount to add to anomaly_
     */
    private static double halleyStep(final double anomaly_, final double residual_, final double e_)
    {
        final double m1p = 1.0 - e_ * FastMath.cos(anomaly_);
        final double m1pp = e_ * FastMath.sin(anomaly_);
        final double m1ppp = 1.0 - m1p;

        final double d1 = -residual_ / m1p;
        final double d2 = -residual_ / (m1p + d1 * m1pp / 2.0);
        final double d3 = -residual_ / (m1p + d2 * m1pp / 2.0 + d2 * d2 * m1ppp / 6.0);
        return d3;
    }

    private static double computeResiduals(final double[] anomaly_, final double[] meanAnomaly_, final double e_,
            final double[] residual_)
    {
        for (int i = 0; i < anomaly_.length; i++)
        {
            residual_[i] = anomaly_[i] - e_ * FastMath.sin(anomaly_[i]) - meanAnomaly_[i];
        }

        return MathFunctions.maxAbs(residual_);
    }

    /**
     * Converts an eccentric anomaly to the true anomaly.
     *
     * @param eccentricAnomaly_ E, in radians
     * @param eccentricity_ e, in [0, 1)
     * @return nu = 2 atan(sqrt((1 + e) / (1 - e)) tan(E / 2))
     */
    public static double trueAnomaly(final double eccentricAnomaly_, final double eccentricity_)
    {
        final double scale = FastMath.sqrt((1.0 + eccentricity_) / (1.0 - eccentricity_));
        final double output = 2.0 * FastMath.atan(scale * FastMath.tan(eccentricAnomaly_ / 2.0));
        return output;
    }

    @Override
    public String toString()
    {
        return "KeplerSolver[" + _tolerance + ", " + _maxIterations + ", " + _check + "]";
    }
}
