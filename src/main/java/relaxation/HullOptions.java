/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package relaxation;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Stream;

import relaxation.GDPException.Kind;
import utility.Kit;

/**
 * Options of a convex hull relaxation run. Options can be set one by one, or read from a map or a properties file, in
 * which case unknown keys are reported and ignored.
 */
public class HullOptions {

    /**
     * The perspective function used for nonlinear constraints
     */
    public static enum Mode {
        /** y*h(v/y), from Lee and Grossmann (2000) */
        CLASSICAL("lee_grossmann"),
        /** (y+eps)*h(v/(y+eps)), from Grossmann and Lee (2003) */
        REGULARIZED("grossmann_lee"),
        /** ((1-eps)*y+eps)*h(v/((1-eps)*y+eps)) - eps*h(0)*(1-y), from Furman, Sawaya and Grossmann (2016) */
        ROBUST("furman_sawaya_grossmann");

        private final String alias;

        Mode(String alias) {
            this.alias = alias;
        }

        /**
         * Returns the mode with the specified name or alias (case is ignored)
         *
         * @throws GDPException
         *             if no mode has this name
         */
        public static Mode of(String name) {
            String s = name.trim().toLowerCase().replace('-', '_');
            return Stream.of(values()).filter(m -> m.name().toLowerCase().equals(s) || m.alias.equals(s)).findFirst()
                    .orElseThrow(() -> new GDPException(Kind.UNKNOWN_FORMULATION_MODE, name, "Unknown formulation mode " + name
                            + "; expected one of classical, regularized, robust"));
        }
    }

    public static final double DEFAULT_EPS = 1e-2;

    public static final String TARGETS = "targets", MODE = "mode", EPS = "eps", RELAX_INDICATORS = "relax_indicators";

    /**
     * Reads options from the specified map. Values may be strings or already typed values.
     */
    public static HullOptions from(Map<String, ?> map) {
        HullOptions options = new HullOptions();
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
            case TARGETS:
                if (value instanceof Collection)
                    options.targets(((Collection<?>) value).toArray());
                else if (value instanceof Object[])
                    options.targets((Object[]) value);
                else if (value instanceof String)
                    options.targets(Stream.of(((String) value).split(",")).map(String::trim).filter(s -> !s.isEmpty()).toArray());
                else
                    options.targets(value);
                break;
            case MODE:
                options.mode(value instanceof Mode ? (Mode) value : Mode.of(String.valueOf(value)));
                break;
            case EPS:
                options.eps(value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(String.valueOf(value).trim()));
                break;
            case RELAX_INDICATORS:
                options.relaxIndicators(value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(String.valueOf(value).trim()));
                break;
            default:
                unknown.add(entry.getKey());
            }
        }
        if (!unknown.isEmpty())
            Kit.log.warning("GDP(CHull): unrecognized options (ignored): " + String.join(", ", unknown));
        return options;
    }

    public static HullOptions load(Properties properties) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames())
            map.put(key, properties.getProperty(key));
        return from(map);
    }

    public static HullOptions load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return load(properties);
    }

    private List<Object> targets;

    private Mode mode = Mode.ROBUST;

    private double eps = DEFAULT_EPS;

    private boolean relaxIndicators = true;

    /**
     * Sets the parts of the model to be transformed: blocks, disjuncts, disjunctions (components or items), or dotted
     * paths resolved from the root. By default, the whole model is transformed.
     */
    public HullOptions targets(Object... targets) {
        this.targets = new ArrayList<>(Arrays.asList(targets));
        return this;
    }

    public HullOptions mode(Mode mode) {
        this.mode = mode;
        return this;
    }

    public HullOptions eps(double eps) {
        if (!(eps > 0 && eps < 1))
            throw new IllegalArgumentException("eps must be in (0,1), not " + eps);
        this.eps = eps;
        return this;
    }

    /**
     * Sets whether the indicator variables of relaxed disjuncts become continuous over [0,1]
     */
    public HullOptions relaxIndicators(boolean relaxIndicators) {
        this.relaxIndicators = relaxIndicators;
        return this;
    }

    /**
     * Returns the targets, or null if the whole model is to be transformed
     */
    public List<Object> targets() {
        return targets == null ? null : Collections.unmodifiableList(targets);
    }

    public Mode mode() {
        return mode;
    }

    public double eps() {
        return eps;
    }

    public boolean relaxIndicators() {
        return relaxIndicators;
    }

    @Override
    public String toString() {
        return "mode=" + mode.name().toLowerCase() + " eps=" + eps + " relax_indicators=" + relaxIndicators + (targets == null ? "" : " targets=" + targets);
    }
}
