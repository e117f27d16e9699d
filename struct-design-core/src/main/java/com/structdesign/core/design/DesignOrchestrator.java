package com.structdesign.core.design;

import com.structdesign.core.config.DesignSettings;
import com.structdesign.core.config.DesignSettings.ServiceabilitySettings;
import com.structdesign.core.design.ReinforcementSelector.StirrupSelection;
import com.structdesign.core.model.DesignCheck;
import com.structdesign.core.model.DesignChecks;
import com.structdesign.core.model.DesignConstraints;
import com.structdesign.core.model.DesignForces;
import com.structdesign.core.model.DesignInput;
import com.structdesign.core.model.DesignResult;
import com.structdesign.core.model.ElementKind;
import com.structdesign.core.model.ElementSummary;
import com.structdesign.core.model.ExposureClass;
import com.structdesign.core.model.FlexuralDesign;
import com.structdesign.core.model.Geometry;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.Reinforcement;
import com.structdesign.core.model.ReinforcementSelection;
import com.structdesign.core.model.ShearDesign;
import com.structdesign.core.model.StirrupDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Designs beams, columns and slabs through the shared pipeline:
 * section, required steel, shear, bar and stirrup selection, capacity and serviceability checks,
 * detailing and cost.
 *
 * <p>Holds only immutable settings. {@link #design(DesignInput)} is safe to call concurrently.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DesignOrchestrator orchestrator = new DesignOrchestrator(ConfigLoader.load(configPath));
 * DesignResult result = orchestrator.design(input);
 * if (!result.valid()) {
 *     result.checks().asMap().forEach((name, check) -> ...);
 * }
 * }</pre>
 */
public class DesignOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DesignOrchestrator.class);

    private final DesignSettings settings;

    public DesignOrchestrator() {
        this(DesignSettings.defaults());
    }

    public DesignOrchestrator(DesignSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public DesignSettings settings() {
        return settings;
    }

    /**
     * Designs one element.
     *
     * @param input design input
     * @return design result; inadequate designs are returned with failed checks
     * @throws com.structdesign.core.exception.InvalidDesignInputException if the cover leaves no effective depth
     */
    public DesignResult design(DesignInput input) {
        Objects.requireNonNull(input, "input must not be null");
        SectionGeometry section = SectionGeometry.of(input);
        List<String> notes = new ArrayList<>();
        addAdvisories(input, notes);

        log.debug("Designing {} '{}' ({}x{} mm, d={} mm)", input.elementKind().id(), input.id(),
            section.width(), section.height(), section.effectiveDepth());

        DesignResult result = switch (input.elementKind()) {
            case BEAM, SLAB -> designFlexuralMember(input, section, notes);
            case COLUMN -> designColumn(input, section, notes);
        };

        log.debug("Designed '{}': {} ({})", result.id(), result.summary(), result.valid() ? "valid" : "invalid");
        return result;
    }

    /**
     * Designs independent elements on the given executor.
     *
     * @param inputs design inputs
     * @param executor executor running the designs
     * @return results in input order
     * @throws com.structdesign.core.exception.InvalidDesignInputException if any input is malformed
     */
    public List<DesignResult> designAll(List<DesignInput> inputs, ExecutorService executor) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(executor, "executor must not be null");

        List<Future<DesignResult>> futures = new ArrayList<>(inputs.size());
        for (DesignInput input : inputs) {
            futures.add(executor.submit(() -> design(input)));
        }

        List<DesignResult> results = new ArrayList<>(futures.size());
        for (Future<DesignResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while designing elements", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new IllegalStateException("Element design failed", e.getCause());
            }
        }
        return results;
    }

    private DesignResult designFlexuralMember(DesignInput input, SectionGeometry section, List<String> notes) {
        ElementKind kind = input.elementKind();
        Materials materials = input.materials();
        DesignForces forces = input.forces();

        FlexuralDesign flexure = FlexuralDesigner.design(forces.momentX(), section, materials);
        if (flexure.clamped()) {
            notes.add("Flexural design clamped at the maximum steel ratio; the section is too small for the moment");
        }
        ShearDesign shear = ShearDesigner.design(forces.shearX(), 0.0, section, materials);

        ReinforcementSelection main = ReinforcementSelector.selectMainBars(flexure.requiredTensionArea(), section);
        ReinforcementSelection compression = flexure.requiredCompressionArea() > 0
            ? ReinforcementSelector.selectCompressionBars(flexure.requiredCompressionArea())
            : null;

        StirrupDetail stirrups = StirrupDetail.none();
        if (kind.hasStirrups()) {
            StirrupSelection selection = ReinforcementSelector.selectStirrups(shear, section, materials,
                main.diameter());
            stirrups = selection.detail();
            shear = shear.withSpacing(selection.limits());
        }
        addShearNotes(shear, stirrups, notes);

        SectionGeometry actual = withSelectedBars(section, stirrups.diameter(), main.diameter(), notes);
        double compressionArea = compression != null ? compression.providedArea() : 0.0;
        double minArea = FlexuralDesigner.minimumRatio(actual, materials) * actual.width() * actual.effectiveDepth();
        double maxArea = flexure.rhoMax() * actual.width() * actual.effectiveDepth() + compressionArea;

        DesignCheck deflection = DesignCheck.notApplicable();
        DesignCheck cracking = DesignCheck.notApplicable();
        if (kind.checksServiceability()) {
            ServiceabilitySettings service = settings.serviceability();
            double span = input.geometry().spanOr(service.defaultSpan());
            deflection = ServiceabilityChecker.deflectionCheck(actual, materials, main.providedArea(),
                serviceMoment(input, span), span, deflectionLimit(input.constraints()));
            cracking = ServiceabilityChecker.crackingCheck(actual, materials, main, crackWidthLimit(input.constraints()));
        }

        DesignChecks checks = new DesignChecks(
            CapacityVerifier.flexure(forces.momentX(), actual, materials, main.providedArea(), compressionArea),
            CapacityVerifier.shear(shear, stirrups, actual, materials, 0.0),
            DesignCheck.notApplicable(),
            deflection,
            cracking,
            CapacityVerifier.minimumReinforcement(minArea, main),
            CapacityVerifier.maximumReinforcement(maxArea, main)
        );

        Double span = input.geometry().span() != null
            ? input.geometry().span()
            : settings.serviceability().defaultSpan();
        return assemble(input, actual, span, flexure, shear, main, compression, stirrups, checks, notes);
    }

    private DesignResult designColumn(DesignInput input, SectionGeometry section, List<String> notes) {
        Materials materials = input.materials();
        DesignForces forces = input.forces();
        if (forces.axial() < 0) {
            notes.add("Axial tension of " + Math.abs(forces.axial()) + " kN is not designed for");
        }

        FlexuralDesign flexure = AxialDesigner.design(forces.axial(), forces.momentX(), section, materials);
        if (flexure.clamped()) {
            notes.add("Column steel clamped at the maximum ratio of 6%; the section is too small for the loads");
        }
        ShearDesign shear = ShearDesigner.design(forces.shearX(), forces.axial(), section, materials);

        ReinforcementSelection main = ReinforcementSelector.selectMainBars(flexure.requiredTensionArea(), section);
        StirrupSelection selection = ReinforcementSelector.selectStirrups(shear, section, materials, main.diameter());
        StirrupDetail ties = selection.detail();
        shear = shear.withSpacing(selection.limits());
        addShearNotes(shear, ties, notes);

        SectionGeometry actual = withSelectedBars(section, ties.diameter(), main.diameter(), notes);
        double ag = actual.grossArea();

        DesignChecks checks = new DesignChecks(
            CapacityVerifier.columnFlexure(forces.axial(), forces.momentX(), actual, materials, main.providedArea()),
            CapacityVerifier.shear(shear, ties, actual, materials, forces.axial()),
            CapacityVerifier.axial(forces.axial(), actual, materials, main.providedArea()),
            DesignCheck.notApplicable(),
            DesignCheck.notApplicable(),
            CapacityVerifier.minimumReinforcement(AxialDesigner.MIN_RATIO * ag, main),
            CapacityVerifier.maximumReinforcement(AxialDesigner.MAX_RATIO * ag, main)
        );

        return assemble(input, actual, input.geometry().span(), flexure, shear, main, null, ties, checks, notes);
    }

    private DesignResult assemble(DesignInput input, SectionGeometry actual, Double span, FlexuralDesign flexure,
                                  ShearDesign shear, ReinforcementSelection main, ReinforcementSelection compression,
                                  StirrupDetail stirrups, DesignChecks checks, List<String> notes) {
        Materials materials = input.materials();
        Reinforcement reinforcement = new Reinforcement(main, compression, stirrups,
            DevelopmentLengthCalculator.calculate(main.diameter(), materials));
        ElementSummary element = new ElementSummary(input.elementKind(), actual.width(), actual.height(), span,
            actual.effectiveDepth(), materials.concreteGrade(), materials.steelGrade());
        double length = input.geometry().spanOr(CostEstimator.UNIT_LENGTH);
        return DesignResult.of(input.id(), element, flexure, shear, reinforcement, checks,
            CostEstimator.estimate(actual, materials, reinforcement, length, settings.cost()), notes);
    }

    /**
     * Rebuilds the section for the selected bars, keeping the first depth estimate when the selected
     * stirrups and bars no longer fit within the cover and height.
     */
    private static SectionGeometry withSelectedBars(SectionGeometry section, int stirrupDiameter, int barDiameter,
                                                    List<String> notes) {
        if (section.fits(stirrupDiameter, barDiameter)) {
            return section.withBars(stirrupDiameter, barDiameter);
        }
        log.warn("D{} stirrups with D{} bars leave no effective depth in a {} mm section; keeping d={} mm",
            stirrupDiameter, barDiameter, section.height(), section.effectiveDepth());
        notes.add("Selected D" + stirrupDiameter + " stirrups and D" + barDiameter
            + " bars leave no effective depth; checks use the estimated d = " + section.effectiveDepth()
            + " mm, increase the height or reduce the cover");
        return section;
    }

    /**
     * Service moment: {@code (D + L)·L²/8} from service loads when given, else the factored moment
     * divided by the configured load factor.
     */
    private double serviceMoment(DesignInput input, double span) {
        double gravity = input.loads().gravity();
        if (gravity > 0) {
            return gravity * span * span / 8.0;
        }
        return Math.abs(input.forces().momentX()) * 1e6 / settings.serviceability().serviceMomentFactor();
    }

    private double deflectionLimit(DesignConstraints constraints) {
        return constraints.deflectionLimit() != null
            ? constraints.deflectionLimit()
            : settings.serviceability().deflectionLimit();
    }

    private double crackWidthLimit(DesignConstraints constraints) {
        if (constraints.crackWidth() != null) {
            return constraints.crackWidth();
        }
        if (constraints.exposure() != null) {
            return constraints.exposure().crackWidthLimit();
        }
        return settings.serviceability().crackWidthLimit();
    }

    private static void addShearNotes(ShearDesign shear, StirrupDetail stirrups, List<String> notes) {
        if (!shear.sectionAdequate()) {
            notes.add(String.format("Required Vs of %.1f kN exceeds the section limit of %.1f kN; enlarge the section",
                shear.vsRequired() / 1e3, shear.vsMax() / 1e3));
        }
        if (stirrups.present() && !stirrups.constructible()) {
            notes.add(String.format("Stirrup spacing of %.0f mm is below the practical minimum of %.0f mm",
                stirrups.spacing(), ReinforcementSelector.MIN_PRACTICAL_SPACING));
        }
    }

    private static void addAdvisories(DesignInput input, List<String> notes) {
        DesignForces forces = input.forces();
        if (forces.momentY() != 0 || forces.shearY() != 0) {
            notes.add("Minor-axis actions (momentY, shearY) are not designed for; design is uniaxial about the major axis");
        }
        if (forces.torsion() != 0) {
            notes.add("Torsion of " + forces.torsion() + " kN·m is not designed for");
        }
        ExposureClass exposure = input.constraints().exposure();
        Geometry geometry = input.geometry();
        if (exposure != null && geometry.clearCover() < exposure.minimumCover()) {
            notes.add(String.format("Clear cover of %.0f mm is below the %d mm minimum for %s exposure",
                geometry.clearCover(), exposure.minimumCover(), exposure.id()));
        }
    }
}
