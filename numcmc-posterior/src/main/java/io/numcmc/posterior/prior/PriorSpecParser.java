package io.numcmc.posterior.prior;

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

import io.numcmc.posterior.transform.Transform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Parses the textual prior form `Family[(p1, p2, ...)][:transform]`.
///
/// ## Grammar
///
/// ```
///   prior     := family [ "(" number { "," number } ")" ] [ ":" transform ]
///   family    := "Uniform" | "Gaussian" | "BimodalGaussian" | "Step"
///   transform := a catalog tag, with "x" optionally spelled as the variable name
/// ```
///
/// | Text | Variable | Result |
/// |------|----------|--------|
/// | `Gaussian(0.55, 0.01):sin^2(x)` | given | Gaussian on sin²x |
/// | `Uniform:sin^2(2Theta13)` | inferred: Theta13 | Uniform on sin²2x |
/// | `Uniform:DeltaCP` | inferred: DeltaCP | Uniform on x |
/// | `Step(75)` | given | Step at 0 on x |
///
/// Parameter arity is checked here; value checks (positive widths, bias range) are
/// done by the family constructors. Both surface as [InvalidPriorParametersException].
public final class PriorSpecParser {

    private static final Logger logger = LogManager.getLogger(PriorSpecParser.class);

    private PriorSpecParser() {
    }

    /// Parses a prior for a known variable.
    ///
    /// @param variable the variable the prior applies to
    /// @param text the textual prior
    /// @return the parsed spec
    /// @throws InvalidPriorParametersException on malformed family parameters
    /// @throws io.numcmc.posterior.transform.UnsupportedTransformException on an unknown transform
    /// @throws IllegalArgumentException on unparseable text
    public static PriorSpec parse(String variable, String text) {
        String[] parts = split(text);
        PriorModel model = parseModel(parts[0]);
        Transform transform = Transform.fromExpression(parts[1], variable);
        PriorSpec spec = new PriorSpec(variable, model, transform);
        logger.debug("Parsed prior '{}' as {}", text, spec);
        return spec;
    }

    /// Parses a prior whose variable is named inside its transform, e.g.
    /// `Uniform:sin^2(2Theta13)`.
    ///
    /// @param text the textual prior
    /// @param candidates the variable names that may appear in the transform
    /// @return the parsed spec
    /// @throws DimensionalityException if the transform names more than one candidate
    /// @throws IllegalArgumentException if it names none
    public static PriorSpec parse(String text, Collection<String> candidates) {
        String[] parts = split(text);
        String expression = parts[1].replaceAll("\\s+", "");
        List<String> found = new ArrayList<>();
        for (String candidate : candidates) {
            if (expression.contains(candidate)) {
                found.add(candidate);
            }
        }
        // SinSqTheta23 names itself, not Theta23
        found.removeIf(name -> found.stream().anyMatch(other -> !other.equals(name) && other.contains(name)));
        if (found.size() > 1) {
            throw new DimensionalityException(
                "Prior '" + text + "' spans more than one variable; only one-dimensional priors are supported:",
                found);
        }
        if (found.isEmpty()) {
            throw new IllegalArgumentException(
                "Prior '" + text + "' does not name its variable; expected one of " + candidates);
        }
        return parse(found.get(0), text);
    }

    /// Parses the family part, e.g. `Gaussian(0.55, 0.01)`.
    ///
    /// @param text the family text, without the transform
    /// @return the family model
    public static PriorModel parseModel(String text) {
        String trimmed = text.trim();
        String family;
        double[] params;
        int open = trimmed.indexOf('(');
        if (open < 0) {
            family = trimmed;
            params = new double[0];
        } else {
            if (!trimmed.endsWith(")")) {
                throw new IllegalArgumentException("Unbalanced parameter list in prior '" + text + "'");
            }
            family = trimmed.substring(0, open).trim();
            params = parseNumbers(family, trimmed.substring(open + 1, trimmed.length() - 1));
        }
        return createModel(family, params);
    }

    /// Creates a family model from its tag and parameter values.
    ///
    /// @param family the family tag
    /// @param params the parameters in textual order
    /// @return the model
    /// @throws InvalidPriorParametersException if the parameter count does not fit the family
    public static PriorModel createModel(String family, double[] params) {
        switch (family) {
            case UniformPrior.FAMILY -> {
                if (params.length == 0) {
                    return UniformPrior.natural();
                }
                requireArity(family, params, 2, 2);
                return new UniformPrior(params[0], params[1]);
            }
            case GaussianPrior.FAMILY -> {
                requireArity(family, params, 2, 2);
                return new GaussianPrior(params[0], params[1]);
            }
            case BimodalGaussianPrior.FAMILY -> {
                requireArity(family, params, 4, 5);
                return params.length == 5
                    ? new BimodalGaussianPrior(params[0], params[1], params[2], params[3], params[4])
                    : new BimodalGaussianPrior(params[0], params[1], params[2], params[3]);
            }
            case StepPrior.FAMILY -> {
                requireArity(family, params, 1, 2);
                return params.length == 2 ? new StepPrior(params[0], params[1]) : new StepPrior(params[0]);
            }
            default -> throw new IllegalArgumentException("Unknown prior family '" + family + "'. Known families: "
                + List.of(UniformPrior.FAMILY, GaussianPrior.FAMILY, BimodalGaussianPrior.FAMILY, StepPrior.FAMILY));
        }
    }

    private static void requireArity(String family, double[] params, int min, int max) {
        if (params.length < min || params.length > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new InvalidPriorParametersException(family, params,
                "expected " + expected + " parameters, got " + params.length);
        }
    }

    private static double[] parseNumbers(String family, String list) {
        if (list.isBlank()) {
            return new double[0];
        }
        String[] tokens = list.split(",");
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                values[i] = Double.parseDouble(tokens[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Parameter '" + tokens[i].trim() + "' of " + family + " prior is not a number", e);
            }
        }
        return values;
    }

    /// Splits family from transform; parameter lists hold only numbers, so the first
    /// colon is the separator.
    private static String[] split(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Prior text must not be empty");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return new String[]{text.trim(), Transform.IDENTITY.tag()};
        }
        return new String[]{text.substring(0, colon).trim(), text.substring(colon + 1).trim()};
    }
}
