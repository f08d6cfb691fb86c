/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit;

import com.powsybl.commons.config.PlatformConfig;
import org.openqc.circuit.transformation.BasisCompletion;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Options of the symbolic circuit analysis.
 *
 * @author open-qcircuit contributors
 */
public class CircuitParameters {

    public static final String MODULE_NAME = "qcircuit-default-parameters";

    public static final String BASIS_COMPLETION_PARAM_NAME = "basisCompletion";

    public static final String FLUX_DYNAMIC_PARAM_NAME = "fluxDynamic";

    public static final String IDENTIFY_LC_VARIABLES_PARAM_NAME = "identifyLcVariables";

    public static final String SYMBOLIC_INVERSION_MAX_NODES_PARAM_NAME = "symbolicInversionMaxNodes";

    public static final String WARNINGS_ENABLED_PARAM_NAME = "warningsEnabled";

    public static final BasisCompletion BASIS_COMPLETION_DEFAULT_VALUE = BasisCompletion.HEURISTIC;

    public static final boolean FLUX_DYNAMIC_DEFAULT_VALUE = true;

    public static final boolean IDENTIFY_LC_VARIABLES_DEFAULT_VALUE = true;

    /**
     * Node count, ground included, up to which the Hamiltonian is generated with the Lagrangian.
     */
    public static final int SYMBOLIC_INVERSION_MAX_NODES_DEFAULT_VALUE = 3;

    public static final boolean WARNINGS_ENABLED_DEFAULT_VALUE = true;

    private BasisCompletion basisCompletion = BASIS_COMPLETION_DEFAULT_VALUE;

    private boolean fluxDynamic = FLUX_DYNAMIC_DEFAULT_VALUE;

    private boolean identifyLcVariables = IDENTIFY_LC_VARIABLES_DEFAULT_VALUE;

    private int symbolicInversionMaxNodes = SYMBOLIC_INVERSION_MAX_NODES_DEFAULT_VALUE;

    private boolean warningsEnabled = WARNINGS_ENABLED_DEFAULT_VALUE;

    public BasisCompletion getBasisCompletion() {
        return basisCompletion;
    }

    public CircuitParameters setBasisCompletion(BasisCompletion basisCompletion) {
        this.basisCompletion = Objects.requireNonNull(basisCompletion);
        return this;
    }

    /**
     * Whether external fluxes are spread over loop branches (time dependent fluxes) instead of being carried by
     * closure branches only.
     */
    public boolean isFluxDynamic() {
        return fluxDynamic;
    }

    public CircuitParameters setFluxDynamic(boolean fluxDynamic) {
        this.fluxDynamic = fluxDynamic;
        return this;
    }

    public boolean isIdentifyLcVariables() {
        return identifyLcVariables;
    }

    public CircuitParameters setIdentifyLcVariables(boolean identifyLcVariables) {
        this.identifyLcVariables = identifyLcVariables;
        return this;
    }

    public int getSymbolicInversionMaxNodes() {
        return symbolicInversionMaxNodes;
    }

    public CircuitParameters setSymbolicInversionMaxNodes(int symbolicInversionMaxNodes) {
        if (symbolicInversionMaxNodes < 0) {
            throw new IllegalArgumentException("Invalid symbolic inversion max node count: " + symbolicInversionMaxNodes);
        }
        this.symbolicInversionMaxNodes = symbolicInversionMaxNodes;
        return this;
    }

    public boolean isWarningsEnabled() {
        return warningsEnabled;
    }

    public CircuitParameters setWarningsEnabled(boolean warningsEnabled) {
        this.warningsEnabled = warningsEnabled;
        return this;
    }

    public static CircuitParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static CircuitParameters load(PlatformConfig platformConfig) {
        CircuitParameters parameters = new CircuitParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setBasisCompletion(config.getEnumProperty(BASIS_COMPLETION_PARAM_NAME, BasisCompletion.class, BASIS_COMPLETION_DEFAULT_VALUE))
                .setFluxDynamic(config.getBooleanProperty(FLUX_DYNAMIC_PARAM_NAME, FLUX_DYNAMIC_DEFAULT_VALUE))
                .setIdentifyLcVariables(config.getBooleanProperty(IDENTIFY_LC_VARIABLES_PARAM_NAME, IDENTIFY_LC_VARIABLES_DEFAULT_VALUE))
                .setSymbolicInversionMaxNodes(config.getIntProperty(SYMBOLIC_INVERSION_MAX_NODES_PARAM_NAME, SYMBOLIC_INVERSION_MAX_NODES_DEFAULT_VALUE))
                .setWarningsEnabled(config.getBooleanProperty(WARNINGS_ENABLED_PARAM_NAME, WARNINGS_ENABLED_DEFAULT_VALUE)));
        return parameters;
    }

    public static CircuitParameters load(Map<String, String> properties) {
        return new CircuitParameters().update(properties);
    }

    public CircuitParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(BASIS_COMPLETION_PARAM_NAME))
                .ifPresent(prop -> this.setBasisCompletion(BasisCompletion.valueOf(prop)));
        Optional.ofNullable(properties.get(FLUX_DYNAMIC_PARAM_NAME))
                .ifPresent(prop -> this.setFluxDynamic(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(IDENTIFY_LC_VARIABLES_PARAM_NAME))
                .ifPresent(prop -> this.setIdentifyLcVariables(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(SYMBOLIC_INVERSION_MAX_NODES_PARAM_NAME))
                .ifPresent(prop -> this.setSymbolicInversionMaxNodes(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(WARNINGS_ENABLED_PARAM_NAME))
                .ifPresent(prop -> this.setWarningsEnabled(Boolean.parseBoolean(prop)));
        return this;
    }

    @Override
    public String toString() {
        return "CircuitParameters("
                + "basisCompletion=" + basisCompletion
                + ", fluxDynamic=" + fluxDynamic
                + ", identifyLcVariables=" + identifyLcVariables
                + ", symbolicInversionMaxNodes=" + symbolicInversionMaxNodes
                + ", warningsEnabled=" + warningsEnabled
                + ")";
    }
}
