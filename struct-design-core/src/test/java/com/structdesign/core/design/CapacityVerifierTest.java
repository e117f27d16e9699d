package com.structdesign.core.design;

import com.structdesign.core.DesignFixtures;
import com.structdesign.core.design.CapacityVerifier.FlexuralCapacity;
import com.structdesign.core.model.CheckStatus;
import com.structdesign.core.model.DesignCheck;
import com.structdesign.core.model.FlexuralDesign;
import com.structdesign.core.model.ReinforcementSelection;
import com.structdesign.core.model.ShearDesign;
import com.structdesign.core.model.StirrupDetail;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CapacityVerifier}.
 */
class CapacityVerifierTest {

    private final SectionGeometry beam = SectionGeometry.of(DesignFixtures.beam(0, 0));
    private final SectionGeometry largeBars = beam.withBars(10, 32);

    @Nested
    class Flexure {

        @ParameterizedTest
        @ValueSource(doubles = {120, 180, 300, 400})
        void flexure_requiredSteel_reproducesDesignMoment(double momentKNm) {
            // Given
            FlexuralDesign design = FlexuralDesigner.design(momentKNm, beam, DesignFixtures.FC30_FY400);

            // When
            FlexuralCapacity capacity = CapacityVerifier.flexuralCapacity(beam, DesignFixtures.FC30_FY400,
                design.requiredTensionArea(), 0);

            // Then
            assertThat(capacity.designMomentKNm() / momentKNm).isCloseTo(1.0, within(1e-6));
        }

        @Test
        void flexuralCapacity_singlyReinforced_matchesStressBlock() {
            FlexuralCapacity capacity = CapacityVerifier.flexuralCapacity(largeBars, DesignFixtures.FC30_FY400,
                3000, 0);

            assertThat(capacity.neutralAxisDepth()).isCloseTo(187.8, within(0.1));
            assertThat(capacity.nominalMoment() / 1e6).isCloseTo(426.7, within(0.1));
            assertThat(capacity.compressionSteelStress()).isZero();
        }

        @Test
        void flexuralCapacity_withCompressionSteel_raisesMomentAndLowersNeutralAxis() {
            FlexuralCapacity without = CapacityVerifier.flexuralCapacity(largeBars, DesignFixtures.FC30_FY400,
                3000, 0);
            FlexuralCapacity with = CapacityVerifier.flexuralCapacity(largeBars, DesignFixtures.FC30_FY400,
                3000, 1000);

            assertThat(with.neutralAxisDepth()).isCloseTo(138.6, within(0.1));
            assertThat(with.nominalMoment()).isGreaterThan(without.nominalMoment());
            assertThat(with.compressionSteelStress()).isPositive().isLessThan(400.0);
        }

        @Test
        void tensionControlledDepth_usesTensionStrainLimit() {
            // 0.004 * 434 / (0.004 + 400 / 200000)
            assertThat(CapacityVerifier.tensionControlledDepth(largeBars, DesignFixtures.FC30_FY400))
                .isCloseTo(289.33, within(0.01));
        }

        @Test
        void flexure_heavilyReinforcedSection_failsAsCompressionControlled() {
            // Given: 12D32 puts the neutral axis near 604 mm
            DesignCheck check = CapacityVerifier.flexure(180, largeBars, DesignFixtures.FC30_FY400, 9648, 0);

            // Then: ample strength, but the section is not tension-controlled
            assertThat(check.provided()).isGreaterThan(check.required());
            assertThat(check.status()).isEqualTo(CheckStatus.FAIL);
        }

        @Test
        void flexure_referenceBeam_passesWithTwoD29() {
            SectionGeometry actual = beam.withBars(8, 29);

            DesignCheck check = CapacityVerifier.flexure(180, actual, DesignFixtures.FC30_FY400, 1322, 0);

            assertThat(check.passed()).isTrue();
            assertThat(check.provided()).isCloseTo(191.8, within(0.5));
        }
    }

    @Nested
    class Shear {

        @Test
        void shear_withStirrups_addsSteelContribution() {
            ShearDesign demand = ShearDesigner.design(120, 0, beam, DesignFixtures.FC30_FY400);
            StirrupDetail stirrups = new StirrupDetail(10, 2, 220, 157.0 / 220, true);

            DesignCheck withStirrups = CapacityVerifier.shear(demand, stirrups, beam, DesignFixtures.FC30_FY400, 0);
            DesignCheck concreteOnly = CapacityVerifier.shear(demand, StirrupDetail.none(), beam,
                DesignFixtures.FC30_FY400, 0);

            assertThat(withStirrups.passed()).isTrue();
            assertThat(concreteOnly.provided()).isCloseTo(0.75 * 121.0467, within(1e-3));
            assertThat(concreteOnly.passed()).isFalse();
            assertThat(withStirrups.provided()).isGreaterThan(concreteOnly.provided());
        }

        @Test
        void shear_steelContribution_isCappedAtSectionLimit() {
            ShearDesign demand = ShearDesigner.design(900, 0, beam, DesignFixtures.FC30_FY400);
            StirrupDetail dense = new StirrupDetail(16, 2, 10, 40.2, false);

            DesignCheck check = CapacityVerifier.shear(demand, dense, beam, DesignFixtures.FC30_FY400, 0);

            double cap = 0.75 * (demand.vc() + demand.vsMax()) / 1e3;
            assertThat(check.provided()).isCloseTo(cap, within(1e-6));
            assertThat(check.passed()).isFalse();
        }
    }

    @Nested
    class Column {

        private final SectionGeometry column = SectionGeometry.of(DesignFixtures.column(0, 0, 0));

        @Test
        void axial_matchesReducedNominalStrength() {
            DesignCheck check = CapacityVerifier.axial(1500, column, DesignFixtures.FC30_FY400, 3200);

            assertThat(check.provided()).isCloseTo(2744.768, within(1e-6));
            assertThat(check.passed()).isTrue();
        }

        @Test
        void axial_overload_fails() {
            DesignCheck check = CapacityVerifier.axial(3000, column, DesignFixtures.FC30_FY400, 3200);

            assertThat(check.passed()).isFalse();
        }

        @Test
        void columnFlexure_usesInteractionCapacity() {
            DesignCheck check = CapacityVerifier.columnFlexure(1500, 40, column, DesignFixtures.FC30_FY400, 3200);

            double expected = AxialDesigner.interactionMomentCapacity(3200, 1.5e6, column,
                DesignFixtures.FC30_FY400) / 1e6;
            assertThat(check.provided()).isCloseTo(expected, within(1e-9));
            assertThat(check.passed()).isTrue();
        }
    }

    @Test
    void reinforcementLimits_compareProvidedArea() {
        ReinforcementSelection twoD29 = ReinforcementSelection.of(29, 661, 2);

        assertThat(CapacityVerifier.minimumReinforcement(459.4, twoD29).passed()).isTrue();
        assertThat(CapacityVerifier.minimumReinforcement(1400, twoD29).passed()).isFalse();
        assertThat(CapacityVerifier.maximumReinforcement(3144.7, twoD29).passed()).isTrue();
        assertThat(CapacityVerifier.maximumReinforcement(1000, twoD29).passed()).isFalse();
    }
}
