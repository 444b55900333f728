package io.numcmc.posterior.histogram;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.numcmc.posterior.sample.MassOrdering;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/// Turns a filled [WeightedHistogram] into a [PosteriorDensity].
///
/// ```
///   density[b] = weight[b] / (inRangeWeight × area[b])
/// ```
///
/// The histogram is only read.
public final class DensityNormalizer {

    private static final Logger logger = LogManager.getLogger(DensityNormalizer.class);

    private DensityNormalizer() {
    }

    /// Normalizes a histogram.
    ///
    /// @param histogram a filled histogram
    /// @return the combined density and, when orderings were separated, the
    ///     per-ordering densities and probabilities
    /// @throws EmptyHistogramException if no weight fell in range
    public static PosteriorDensity normalize(WeightedHistogram histogram) {
        double total = histogram.inRangeWeight();
        if (!(total > 0)) {
            throw new EmptyHistogramException("Cannot normalize " + histogram + ": no in-range weight",
                histogram.outOfRangeCount(), histogram.rejectedCount());
        }
        Density combined = Density.fromWeights(histogram.axes(), histogram.weights(), total);

        Map<MassOrdering, Density> byOrdering = new EnumMap<>(MassOrdering.class);
        Map<MassOrdering, Density> joint = new EnumMap<>(MassOrdering.class);
        Map<MassOrdering, Double> probability = new EnumMap<>(MassOrdering.class);
        Map<MassOrdering, Double> inRangeFraction = new EnumMap<>(MassOrdering.class);
        if (histogram.separatesOrderings()) {
            for (MassOrdering ordering : MassOrdering.values()) {
                double orderingTotal = histogram.inRangeWeight(ordering);
                probability.put(ordering, orderingTotal / total);
                if (!(orderingTotal > 0)) {
                    logger.warn("No in-range weight for {} samples; omitting its density", ordering);
                    continue;
                }
                double[] weights = histogram.weights(ordering);
                byOrdering.put(ordering, Density.fromWeights(histogram.axes(), weights, orderingTotal));
                joint.put(ordering, Density.fromWeights(histogram.axes(), weights, total));
                inRangeFraction.put(ordering,
                    orderingTotal / (orderingTotal + histogram.outOfRangeWeight(ordering)));
            }
            logger.debug("Ordering probabilities: {}", probability);
        }
        return new PosteriorDensity(combined, byOrdering, joint, probability, inRangeFraction,
            total, histogram.outOfRangeWeight());
    }
}
