package com.edge.marker.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkerRoleTest {

    @Test
    void idsAreBoundToCorners() {
        assertThat(MarkerRole.fromMarkerId(0)).isEqualTo(MarkerRole.TOP_LEFT);
        assertThat(MarkerRole.fromMarkerId(1)).isEqualTo(MarkerRole.TOP_RIGHT);
        assertThat(MarkerRole.fromMarkerId(2)).isEqualTo(MarkerRole.BOTTOM_RIGHT);
        assertThat(MarkerRole.fromMarkerId(3)).isEqualTo(MarkerRole.BOTTOM_LEFT);
        assertThatThrownBy(() -> MarkerRole.fromMarkerId(4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void innerCornerIsOppositeOfOuter() {
        for (MarkerRole role : MarkerRole.values()) {
            assertThat(role.getInnerCorner()).isEqualTo((role.getOuterCorner() + 2) % 4);
        }
    }

    @Test
    void oppositeRole() {
        assertThat(MarkerRole.TOP_LEFT.opposite()).isEqualTo(MarkerRole.BOTTOM_RIGHT);
        assertThat(MarkerRole.TOP_RIGHT.opposite()).isEqualTo(MarkerRole.BOTTOM_LEFT);
        assertThat(MarkerRole.BOTTOM_LEFT.opposite()).isEqualTo(MarkerRole.TOP_RIGHT);
    }
}
