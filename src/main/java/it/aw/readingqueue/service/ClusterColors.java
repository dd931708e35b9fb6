package it.aw.readingqueue.service;

import java.util.Locale;

/**
 * Colori di visualizzazione dei cluster, derivati dal testo dell'etichetta:
 * la stessa etichetta ha sempre lo stesso colore, qualunque sia l'id del cluster.
 */
public final class ClusterColors {

    /** Grigio neutro per item non clusterizzati ed etichette di ripiego. */
    public static final String NEUTRAL = "#80848c";

    private static final double GOLDEN_ANGLE = 137.508;
    private static final double SATURATION = 0.58;
    private static final double LIGHTNESS = 0.55;

    private ClusterColors() {
    }

    public static String forLabel(String label) {
        if (label == null || label.isBlank()) {
            return NEUTRAL;
        }
        int hash = label.strip().toLowerCase(Locale.ROOT).hashCode() & 0x7fffffff;
        double hue = (hash * GOLDEN_ANGLE) % 360.0;
        return hslToHex(hue, SATURATION, LIGHTNESS);
    }

    static String hslToHex(double hue, double s, double l) {
        double c = (1 - Math.abs(2 * l - 1)) * s;
        double hp = hue / 60.0;
        double x = c * (1 - Math.abs(hp % 2 - 1));
        double r, g, b;
        if (hp < 1)      { r = c; g = x; b = 0; }
        else if (hp < 2) { r = x; g = c; b = 0; }
        else if (hp < 3) { r = 0; g = c; b = x; }
        else if (hp < 4) { r = 0; g = x; b = c; }
        else if (hp < 5) { r = x; g = 0; b = c; }
        else             { r = c; g = 0; b = x; }
        double m = l - c / 2;
        return String.format("#%02x%02x%02x", channel(r + m), channel(g + m), channel(b + m));
    }

    private static int channel(double v) {
        return (int) Math.round(Math.max(0, Math.min(1, v)) * 255);
    }
}
