package nl.bytesoflife.spectrosim.catalog;

/**
 * Spatial scale of the integral field unit.
 *
 * @param nominalX nominal scale along x (mas), as used in the scale name
 * @param nominalY nominal scale along y (mas)
 * @param spaxelX  actual spaxel size along x (mas)
 * @param spaxelY  actual spaxel size along y (mas)
 */
public record SpaxelScale(int nominalX, int nominalY, double spaxelX, double spaxelY) {

    public SpaxelScale {
        if (nominalX <= 0 || nominalY <= 0) {
            throw new IllegalArgumentException("Nominal scale must be positive: " + nominalX + "x" + nominalY);
        }
        if (!(spaxelX > 0 && spaxelY > 0)) {
            throw new IllegalArgumentException("Spaxel size must be positive");
        }
    }

    /** Scale name such as "60x30". */
    public String name() {
        return nominalX + "x" + nominalY;
    }

    /** Solid angle of one spaxel in square milliarcseconds. */
    public double spaxelArea() {
        return spaxelX * spaxelY;
    }
}
