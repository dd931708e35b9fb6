package it.aw.readingqueue.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClusterColorsTest {

    @Test
    @DisplayName("stessa etichetta, stesso colore, senza distinzione di maiuscole e spazi")
    void stableByLabel() {
        assertThat(ClusterColors.forLabel("Machine Learning"))
                .isEqualTo(ClusterColors.forLabel("  machine learning "))
                .matches("#[0-9a-f]{6}");
    }

    @Test
    @DisplayName("etichette diverse danno in genere colori diversi")
    void distinctLabels() {
        assertThat(ClusterColors.forLabel("Politics")).isNotEqualTo(ClusterColors.forLabel("Cooking"));
    }

    @Test
    @DisplayName("etichetta assente: grigio neutro")
    void neutral() {
        assertThat(ClusterColors.forLabel(null)).isEqualTo(ClusterColors.NEUTRAL);
        assertThat(ClusterColors.forLabel(" ")).isEqualTo(ClusterColors.NEUTRAL);
    }

    @Test
    @DisplayName("conversione HSL: rosso, verde e blu puri")
    void hslConversion() {
        assertThat(ClusterColors.hslToHex(0, 1, 0.5)).isEqualTo("#ff0000");
        assertThat(ClusterColors.hslToHex(120, 1, 0.5)).isEqualTo("#00ff00");
        assertThat(ClusterColors.hslToHex(240, 1, 0.5)).isEqualTo("#0000ff");
    }
}
