package it.aw.readingqueue.model;

/** Posizione 2D di un item nel layout. x e y sono finiti oppure null, mai NaN. */
public record Coordinate(String itemId, Double x, Double y) {

    public static Coordinate of(String itemId, double x, double y) {
        return new Coordinate(itemId, finiteOrNull(x), finiteOrNull(y));
    }

    private static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }
}
