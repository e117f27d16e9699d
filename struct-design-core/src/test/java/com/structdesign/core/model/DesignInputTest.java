package com.structdesign.core.model;

import com.structdesign.core.exception.InvalidDesignInputException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DesignInput} and its component records.
 */
class DesignInputTest {

    private static final Geometry GEOMETRY = new Geometry(300, 500, 6000.0, 40);
    private static final Materials MATERIALS = new Materials(30, 400);

    @Nested
    class Defaults {

        @Test
        void constructor_withNullOptionalParts_fillsDefaults() {
            DesignInput input = new DesignInput(null, ElementKind.BEAM, GEOMETRY, MATERIALS, null, null, null);

            assertThat(input.id()).isEqualTo("beam");
            assertThat(input.loads()).isEqualTo(ServiceLoads.none());
            assertThat(input.forces()).isEqualTo(DesignForces.none());
            assertThat(input.constraints()).isEqualTo(DesignConstraints.none());
        }

        @Test
        void constructor_withBlankId_usesElementKind() {
            DesignInput input = new DesignInput("  ", ElementKind.SLAB, GEOMETRY, MATERIALS, null, null, null);

            assertThat(input.id()).isEqualTo("slab");
        }

        @Test
        void withForces_keepsEverythingElse() {
            DesignInput input = new DesignInput("B7", ElementKind.BEAM, GEOMETRY, MATERIALS, null, null, null);

            DesignInput changed = input.withForces(DesignForces.bending(100, 50));

            assertThat(changed.id()).isEqualTo("B7");
            assertThat(changed.geometry()).isEqualTo(GEOMETRY);
            assertThat(changed.forces().momentX()).isEqualTo(100);
        }
    }

    @Nested
    class Preconditions {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -300.0, Double.NaN, Double.POSITIVE_INFINITY})
        void geometry_withInvalidWidth_namesWidthField(double width) {
            assertThatThrownBy(() -> new Geometry(width, 500, null, 40))
                .isInstanceOf(InvalidDesignInputException.class)
                .extracting(e -> ((InvalidDesignInputException) e).getField())
                .isEqualTo("geometry.width");
        }

        @Test
        void geometry_withZeroHeight_namesHeightField() {
            assertThatThrownBy(() -> new Geometry(300, 0, null, 40))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("geometry.height");
        }

        @Test
        void geometry_withNegativeCover_namesCoverField() {
            assertThatThrownBy(() -> new Geometry(300, 500, null, -1))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("geometry.clearCover");
        }

        @Test
        void geometry_withZeroCover_isAccepted() {
            assertThat(new Geometry(300, 500, null, 0).clearCover()).isZero();
        }

        @Test
        void geometry_withNegativeSpan_namesSpanField() {
            assertThatThrownBy(() -> new Geometry(300, 500, -10.0, 40))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("geometry.span");
        }

        @Test
        void materials_withNonPositiveStrengths_nameTheirFields() {
            assertThatThrownBy(() -> new Materials(0, 400))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("materials.fc");
            assertThatThrownBy(() -> new Materials(30, -400))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("materials.fy");
        }

        @Test
        void materials_belowCodeRange_isAccepted() {
            Materials weak = new Materials(10, 240);

            assertThat(weak.concreteGrade()).isEqualTo("fc10");
            assertThat(weak.steelGrade()).isEqualTo("fy240");
        }

        @Test
        void constraints_withNonPositiveLimits_throwException() {
            assertThatThrownBy(() -> new DesignConstraints(0.0, null, null))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("constraints.deflectionLimit");
            assertThatThrownBy(() -> new DesignConstraints(null, -0.1, null))
                .isInstanceOf(InvalidDesignInputException.class)
                .hasMessageContaining("constraints.crackWidth");
        }

        @Test
        void constructor_withNullElementKind_namesElementKindField() {
            assertThatThrownBy(() -> new DesignInput("x", null, GEOMETRY, MATERIALS, null, null, null))
                .isInstanceOf(InvalidDesignInputException.class)
                .extracting(e -> ((InvalidDesignInputException) e).getField())
                .isEqualTo("elementKind");
        }

        @Test
        void constructor_withNullGeometry_throwsException() {
            assertThatThrownBy(() -> new DesignInput("x", ElementKind.BEAM, null, MATERIALS, null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("geometry must not be null");
        }
    }

    @Nested
    class Enums {

        @Test
        void elementKind_fromId_ignoresCase() {
            assertThat(ElementKind.fromId("Column")).isEqualTo(ElementKind.COLUMN);
        }

        @Test
        void elementKind_fromUnknownId_throwsException() {
            assertThatThrownBy(() -> ElementKind.fromId("truss"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("truss");
        }

        @Test
        void exposureClass_isOrderedByCoverAndCrackLimit() {
            ExposureClass previous = null;
            for (ExposureClass exposure : ExposureClass.values()) {
                if (previous != null) {
                    assertThat(exposure.minimumCover()).isGreaterThan(previous.minimumCover());
                    assertThat(exposure.crackWidthLimit()).isLessThan(previous.crackWidthLimit());
                }
                previous = exposure;
            }
        }

        @Test
        void exposureClass_fromId_acceptsHyphens() {
            assertThat(ExposureClass.fromId("very-severe")).isEqualTo(ExposureClass.VERY_SEVERE);
            assertThat(ExposureClass.fromId(null)).isNull();
        }

        @Test
        void barLayout_forCount_classifiesRows() {
            assertThat(BarLayout.forCount(2)).isEqualTo(BarLayout.SINGLE_ROW);
            assertThat(BarLayout.forCount(4)).isEqualTo(BarLayout.SINGLE_ROW);
            assertThat(BarLayout.forCount(6)).isEqualTo(BarLayout.DOUBLE_ROW);
            assertThat(BarLayout.forCount(9)).isEqualTo(BarLayout.MULTI_ROW);
        }
    }

    @Test
    void reinforcementSelection_of_derivesAreaAndNotation() {
        ReinforcementSelection selection = ReinforcementSelection.of(19, 284.0, 4);

        assertThat(selection.providedArea()).isEqualTo(1136.0);
        assertThat(selection.layout()).isEqualTo(BarLayout.SINGLE_ROW);
        assertThat(selection.notation()).isEqualTo("4D19");
    }

    @Test
    void reinforcementSelection_withZeroBars_throwsException() {
        assertThatThrownBy(() -> ReinforcementSelection.of(19, 284.0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
