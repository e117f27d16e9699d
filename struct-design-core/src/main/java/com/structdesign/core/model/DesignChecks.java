package com.structdesign.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The fixed set of named checks reported for every element.
 *
 * @param flexuralStrength design moment capacity against factored moment (kN·m), including ductility
 * @param shearStrength design shear capacity against factored shear (kN)
 * @param axialStrength design axial capacity against factored axial load (kN), columns only
 * @param deflection immediate service deflection against span/N (mm)
 * @param cracking crack width against the allowable width (mm)
 * @param minReinforcement provided tension steel against the minimum area (mm²)
 * @param maxReinforcement provided tension steel against the maximum area (mm²)
 */
public record DesignChecks(
    DesignCheck flexuralStrength,
    DesignCheck shearStrength,
    DesignCheck axialStrength,
    DesignCheck deflection,
    DesignCheck cracking,
    DesignCheck minReinforcement,
    DesignCheck maxReinforcement
) {
    /**
     * Compact constructor with validation.
     */
    public DesignChecks {
        Objects.requireNonNull(flexuralStrength, "flexuralStrength must not be null");
        Objects.requireNonNull(shearStrength, "shearStrength must not be null");
        Objects.requireNonNull(axialStrength, "axialStrength must not be null");
        Objects.requireNonNull(deflection, "deflection must not be null");
        Objects.requireNonNull(cracking, "cracking must not be null");
        Objects.requireNonNull(minReinforcement, "minReinforcement must not be null");
        Objects.requireNonNull(maxReinforcement, "maxReinforcement must not be null");
    }

    /**
     * Checks keyed by name, in declaration order.
     *
     * @return ordered map of check name to check
     */
    public Map<String, DesignCheck> asMap() {
        Map<String, DesignCheck> checks = new LinkedHashMap<>();
        checks.put("flexuralStrength", flexuralStrength);
        checks.put("shearStrength", shearStrength);
        checks.put("axialStrength", axialStrength);
        checks.put("deflection", deflection);
        checks.put("cracking", cracking);
        checks.put("minReinforcement", minReinforcement);
        checks.put("maxReinforcement", maxReinforcement);
        return checks;
    }

    /**
     * AND of all check statuses.
     *
     * @return true when every check passes
     */
    public boolean allPassed() {
        return asMap().values().stream().allMatch(DesignCheck::passed);
    }
}
