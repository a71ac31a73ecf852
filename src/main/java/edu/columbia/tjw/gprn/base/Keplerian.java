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

import edu.columbia.tjw.gprn.InvalidParameterException;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.MeanSettings;
import edu.columbia.tjw.gprn.orbit.KeplerSolution;
import edu.columbia.tjw.gprn.orbit.KeplerSolver;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.util.FastMath;

/**
 * Radial velocity of a star with one companion on a Keplerian orbit,
 *
 * RV(t) = K (e cos(w) + cos(w + nu(t))) + sysVel
 *
 * where nu is the true anomaly. Parameters, in order: period P (days, &gt; 0),
 * semi-amplitude K, eccentricity e (0 &lt;= e &lt; 1), argument of periastron
 * w, orbital phase phi and systemic velocity.
 *
 * The reference epoch is tied to the first element of the evaluated vector,
 * T0 = t[0] - P phi / (2 pi).
 *
 * @author tyler
 */
public final class Keplerian extends AbstractMeanFunction
{
    private static final List<String> PARAM_NAMES = Arrays.asList("period", "semiAmplitude", "eccentricity",
            "periastron", "phase", "systemicVelocity");

    private static final int PERIOD_INDEX = 0;
    private static final int AMPLITUDE_INDEX = 1;
    private static final int ECCENTRICITY_INDEX = 2;
    private static final int PERIASTRON_INDEX = 3;
    private static final int PHASE_INDEX = 4;
    private static final int SYSTEMIC_INDEX = 5;

    private final KeplerSolver _solver;

    public Keplerian(final double period_, final double semiAmplitude_, final double eccentricity_,
            final double periastron_, final double phase_, final double systemicVelocity_)
    {
        this(MeanSettings.getDefault(), period_, semiAmplitude_, eccentricity_, periastron_, phase_,
                systemicVelocity_);
    }

    public Keplerian(final MeanSettings settings_, final double period_, final double semiAmplitude_,
            final double eccentricity_, final double periastron_, final double phase_, final double systemicVelocity_)
    {
        super(MeanFunctionType.KEPLERIAN, PARAM_NAMES, new double[]
        {
            period_, semiAmplitude_, eccentricity_, periastron_, phase_, systemicVelocity_
        });

        _solver = new KeplerSolver(settings_);
    }

    private Keplerian(final MeanSettings settings_)
    {
        super(MeanFunctionType.KEPLERIAN, PARAM_NAMES, new double[PARAM_NAMES.size()], false);
        _solver = new KeplerSolver(settings_);
    }

    /**
     * A placeholder with all parameters zero. A zero period cannot be
     * evaluated, so parameters must be set before the first call to evaluate.
     *
     * @return A new zero Keplerian
     */
    public static Keplerian initialize()
    {
        return initialize(MeanSettings.getDefault());
    }

    public static Keplerian initialize(final MeanSettings settings_)
    {
        return new Keplerian(settings_);
    }

    @Override
    protected void validate(final double[] params_)
    {
        super.validate(params_);

        final double period = params_[PERIOD_INDEX];
        final double e = params_[ECCENTRICITY_INDEX];

        if (!(period > 0.0))
        {
            throw new InvalidParameterException("Period must be positive: " + period);
        }
        if (!(e >= 0.0 && e < 1.0))
        {
            throw new InvalidParameterException("Eccentricity must be in [0, 1): " + e);
        }
    }

    public KeplerSolver getSolver()
    {
        return _solver;
    }

    /**
     * Mean anomaly at each time, M = 2 pi (t - T0) / P.
     *
     * @param times_ The times of interest, not modified
     * @return A new array of mean anomalies
     */
    public double[] meanAnomaly(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] params = params();
        return meanAnomaly(times, params[PERIOD_INDEX], params[PHASE_INDEX]);
    }

    private static double[] meanAnomaly(final double[] times_, final double period_, final double phase_)
    {
        final double[] output = new double[times_.length];

        if (times_.length < 1)
        {
            return output;
        }

        final double epoch = times_[0] - (period_ * phase_) / MathFunctions.TWO_PI;

        for (int i = 0; i < times_.length; i++)
        {
            output[i] = MathFunctions.TWO_PI * (times_[i] - epoch) / period_;
        }

        return output;
    }

    /**
     * Solves for the eccentric anomaly at each time, exposing the state of the
     * iteration.
     *
     * @param times_ The times of interest, not modified
     * @return The solver output for these times
     */
    public KeplerSolution solve(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] params = params();
        validate(params);
        final double[] meanAnomaly = meanAnomaly(times, params[PERIOD_INDEX], params[PHASE_INDEX]);
        return _solver.solve(meanAnomaly, params[ECCENTRICITY_INDEX]);
    }

    @Override
    public double[] evaluate(final double[] times_)
    {
        final double[] times = MathFunctions.checkTimes(times_);
        final double[] params = params();

        //Zero placeholders get this far, catch them before dividing by the period.
        validate(params);

        final double period = params[PERIOD_INDEX];
        final double amplitude = params[AMPLITUDE_INDEX];
        final double e = params[ECCENTRICITY_INDEX];
        final double w = params[PERIASTRON_INDEX];
        final double phase = params[PHASE_INDEX];
        final double systemic = params[SYSTEMIC_INDEX];

        final double[] meanAnomaly = meanAnomaly(times, period, phase);
        final KeplerSolution solution = _solver.solve(meanAnomaly, e);

        final double ecosw = e * FastMath.cos(w);
        final double[] output = new double[times.length];

        for (int i = 0; i < times.length; i++)
        {
            final double nu = KeplerSolver.trueAnomaly(solution.getEccentricAnomaly(i), e);
            output[i] = amplitude * (ecosw + FastMath.cos(w + nu)) + systemic;
        }

        return output;
    }
}
