package com.alfacon.weather.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceRangeTest {

    @Test
    void enumeratesInclusiveRange() {
        DeviceRange range = new DeviceRange("CAL", 251, 260);

        assertThat(range.size()).isEqualTo(10);
        assertThat(range.identifiers()).hasSize(10).startsWith("CAL251", "CAL252").endsWith("CAL260");
        assertThat(range).hasToString("CAL251..CAL260");
    }

    @Test
    void defaultDeploymentCoversOneHundredAndOneDevices() {
        assertThat(new DeviceRange("CAL", 251, 351).identifiers()).hasSize(101).doesNotHaveDuplicates();
    }

    @Test
    void rejectsInvertedRange() {
        assertThatThrownBy(() -> new DeviceRange("CAL", 300, 299))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
