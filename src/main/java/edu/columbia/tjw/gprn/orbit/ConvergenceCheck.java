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
 * How the Kepler solver decides it may stop refining the eccentric anomaly.
 *
 * @author tyler
 */
public enum ConvergenceCheck
{
    /**
     * Enters the refinement loop only if some element misses the tolerance,
     * and then stops after one pass over the whole vector whatever the
     * remaining residual. Use this to reproduce fits made with the older
     * stopping test, which never counted an unconverged element after the
     * first pass. At high eccentricity the result may still be off by more
     * than the tolerance, see KeplerSolution.isConverged().
     */
    SINGLE_PASS,
    /**
     * Refines the whole vector until the largest residual |E - e sin(E) - M|
     * is within tolerance, or the iteration cap is reached.
     */
    MAX_RESIDUAL;
}
